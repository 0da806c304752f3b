package io.github.jakubt4.skypointer.astro;

import lombok.RequiredArgsConstructor;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;

/**
 * Turns orbital elements into ecliptic Cartesian coordinates and shifts them to
 * the Earth's centre.
 */
@RequiredArgsConstructor
public class EclipticTransform {

    private final KeplerSolver keplerSolver;

    /**
     * Position of a body in the frame its elements are referred to: heliocentric for
     * planets, geocentric for the Moon.
     */
    public Vector3D orbitalPosition(final OrbitalElements elements) {
        final var reduced = elements.reduced();
        final var n = FastMath.toRadians(reduced.longitudeOfNode());
        final var i = FastMath.toRadians(reduced.inclination());
        final var w = FastMath.toRadians(reduced.argumentOfPerihelion());
        final var m = FastMath.toRadians(reduced.meanAnomaly());
        final var a = reduced.semiMajorAxis();
        final var e = reduced.eccentricity();

        final var bigE = keplerSolver.eccentricAnomaly(m, e);

        final var xv = a * (FastMath.cos(bigE) - e);
        final var yv = a * FastMath.sqrt(1.0 - e * e) * FastMath.sin(bigE);
        final var v = FastMath.atan2(yv, xv);
        final var r = FastMath.sqrt(xv * xv + yv * yv);

        final var cosN = FastMath.cos(n);
        final var sinN = FastMath.sin(n);
        final var cosVw = FastMath.cos(v + w);
        final var sinVw = FastMath.sin(v + w);
        final var cosI = FastMath.cos(i);

        return new Vector3D(
                r * (cosN * cosVw - sinN * sinVw * cosI),
                r * (sinN * cosVw + cosN * sinVw * cosI),
                r * sinVw * FastMath.sin(i));
    }

    /**
     * Sun's geocentric position from its own element row (N = i = 0, so it stays in
     * the ecliptic plane).
     */
    public SunPosition sunPosition(final OrbitalElements sunElements) {
        final var reduced = sunElements.reduced();
        final var w = FastMath.toRadians(reduced.argumentOfPerihelion());
        final var m = FastMath.toRadians(reduced.meanAnomaly());
        final var e = reduced.eccentricity();

        final var bigE = keplerSolver.eccentricAnomaly(m, e);

        final var xv = reduced.semiMajorAxis() * (FastMath.cos(bigE) - e);
        final var yv = reduced.semiMajorAxis() * FastMath.sqrt(1.0 - e * e) * FastMath.sin(bigE);
        final var v = FastMath.atan2(yv, xv);
        final var rs = FastMath.sqrt(xv * xv + yv * yv);

        final var longitude = Angles.reduceRadians(v + w);
        return new SunPosition(longitude, rs,
                new Vector3D(rs * FastMath.cos(longitude), rs * FastMath.sin(longitude), 0.0));
    }

    /**
     * Geocentric ecliptic position of a solar-system body.
     *
     * @param elements the body's own elements; ignored for the Sun
     * @throws IllegalArgumentException for catalog bodies
     */
    public EclipticPosition geocentric(final CelestialBody body, final OrbitalElements elements, final SunPosition sun) {
        return switch (body.category()) {
            case SUN -> new EclipticPosition(sun.geocentric(), 0.0);
            case MOON -> new EclipticPosition(orbitalPosition(elements), 0.0);
            case PLANET -> {
                final var heliocentric = orbitalPosition(elements);
                yield new EclipticPosition(heliocentric.add(sun.geocentric()), heliocentric.getNorm());
            }
            default -> throw new IllegalArgumentException(body.displayName() + " has no ecliptic orbit");
        };
    }
}
