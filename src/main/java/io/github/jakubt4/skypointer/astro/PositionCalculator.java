package io.github.jakubt4.skypointer.astro;

import io.github.jakubt4.skypointer.astro.time.SimulationInstant;
import io.github.jakubt4.skypointer.astro.time.TimeMode;
import io.github.jakubt4.skypointer.astro.time.TimeModel;
import io.github.jakubt4.skypointer.astro.time.TimeState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.util.FastMath;

import java.util.Objects;

/**
 * Entry point of the astronomy pipeline.
 *
 * <p>Solar-system bodies go through elements, Kepler, ecliptic and equatorial
 * transforms; stars and galaxies start from their catalog RA/Dec. Both paths end in
 * the horizontal transform for the given observer. Apart from reading the clock in
 * live mode and advancing the caller's {@link TimeState} in accelerated mode, every
 * call is a pure function of its arguments.
 *
 * @see io.github.jakubt4.skypointer.service.TrackingService
 */
@Slf4j
@RequiredArgsConstructor
public class PositionCalculator {

    /** Earth radius in km over the astronomical unit in km. */
    static final double AU_PER_EARTH_RADIUS = 6371.0 / 149_597_870.7;

    private final TimeModel timeModel;
    private final OrbitalElementProvider elementProvider;
    private final EclipticTransform eclipticTransform;

    /**
     * @throws io.github.jakubt4.skypointer.error.UnknownBodyException if the identifier matches no body
     * @see #computePosition(CelestialBody, TimeMode, Observer, TimeState)
     */
    public PositionResult computePosition(final String bodyId, final TimeMode mode,
                                          final Observer observer, final TimeState clockState) {
        return computePosition(CelestialBody.fromId(bodyId), mode, observer, clockState);
    }

    /**
     * Resolves the instant for {@code mode} and computes the body's position for the observer.
     *
     * @param clockState simulated clock, advanced in place in accelerated mode; may be {@code null} otherwise
     * @throws io.github.jakubt4.skypointer.error.ValidationException  if the time input is unusable
     * @throws io.github.jakubt4.skypointer.error.ConvergenceException if Kepler's equation cannot be solved
     */
    public PositionResult computePosition(final CelestialBody body, final TimeMode mode,
                                          final Observer observer, final TimeState clockState) {
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(observer, "observer");
        return computeAt(body, timeModel.resolve(mode, clockState), observer);
    }

    public PositionResult computeAt(final CelestialBody body, final SimulationInstant instant, final Observer observer) {
        final var d = instant.dayNumber();
        final var sun = eclipticTransform.sunPosition(elementProvider.elementsOf(CelestialBody.SUN, d));

        final EquatorialCoordinates equatorial;
        final double heliocentricDistance;
        if (body.isCatalog()) {
            equatorial = EquatorialCoordinates.ofCatalog(body);
            heliocentricDistance = 0.0;
        } else {
            final var elements = body == CelestialBody.SUN ? null : elementProvider.elementsOf(body, d);
            final var ecliptic = eclipticTransform.geocentric(body, elements, sun);
            final var converted = EquatorialTransform.toEquatorial(ecliptic.geocentric(), d);
            equatorial = body == CelestialBody.MOON
                    ? converted.withDistance(converted.distance() * AU_PER_EARTH_RADIUS)
                    : converted;
            heliocentricDistance = ecliptic.heliocentricDistance();
        }

        final var lst = HorizontalTransform.localSiderealTime(
                sun.eclipticLongitude(), instant.universalTime(), observer.longitudeDeg());
        final var horizontal = HorizontalTransform.toHorizontal(equatorial, lst, observer.latitudeRad());

        log.debug("[{}] d={} LST={}h RA={} deg Dec={} deg -> alt={} deg, az={} deg",
                body.displayName(),
                String.format("%.5f", d),
                String.format("%.4f", lst),
                String.format("%.4f", FastMath.toDegrees(equatorial.rightAscension())),
                String.format("%.4f", FastMath.toDegrees(equatorial.declination())),
                String.format("%.2f", horizontal.altitude()),
                String.format("%.2f", horizontal.azimuth()));

        return new PositionResult(body,
                horizontal.altitude(),
                horizontal.azimuth(),
                equatorial.rightAscension(),
                equatorial.declination(),
                equatorial.distance(),
                heliocentricDistance,
                instant);
    }
}
