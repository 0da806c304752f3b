package io.github.jakubt4.skypointer.astro;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class EclipticTransformTest {

    private static final double OCT_12_2018_2130 = 6_860.895833333333;

    private final OrbitalElementProvider provider = new OrbitalElementProvider();
    private final EclipticTransform transform = new EclipticTransform(new KeplerSolver());

    @Test
    void sunNearPerihelionAtStartOf2000() {
        final var sun = transform.sunPosition(provider.elementsOf(CelestialBody.SUN, 1.0));

        assertThat(Math.toDegrees(sun.eclipticLongitude())).isCloseTo(279.8718175, within(1e-6));
        assertThat(sun.distance()).isCloseTo(0.9833141727, within(1e-9));
        assertThat(sun.geocentric().getZ()).isZero();
        assertThat(sun.geocentric().getNorm()).isCloseTo(sun.distance(), within(1e-12));
    }

    @Test
    void circularOrbitInEclipticKeepsRadius() {
        final var elements = new OrbitalElements(0.0, 0.0, 0.0, 2.0, 0.0, 90.0);

        final var position = transform.orbitalPosition(elements);

        assertThat(position.getX()).isCloseTo(0.0, within(1e-12));
        assertThat(position.getY()).isCloseTo(2.0, within(1e-12));
        assertThat(position.getZ()).isCloseTo(0.0, within(1e-12));
    }

    @Test
    void inclinationLiftsOrbitOutOfEcliptic() {
        // ascending node on the x axis, body 90 deg past it on a 90 deg inclined orbit
        final var elements = new OrbitalElements(0.0, 90.0, 90.0, 1.0, 0.0, 0.0);

        final var position = transform.orbitalPosition(elements);

        assertThat(position.getZ()).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void planetGeocentricPositionAddsSunVector() {
        final var sun = transform.sunPosition(provider.elementsOf(CelestialBody.SUN, OCT_12_2018_2130));
        final var marsElements = provider.elementsOf(CelestialBody.MARS, OCT_12_2018_2130);

        final var position = transform.geocentric(CelestialBody.MARS, marsElements, sun);
        final var heliocentric = transform.orbitalPosition(marsElements);

        assertThat(position.heliocentricDistance()).isCloseTo(1.3863626326, within(1e-9));
        assertThat(Vector3D.distance(position.geocentric(), heliocentric.add(sun.geocentric()))).isLessThan(1e-12);
    }

    @Test
    void sunIsNotTreatedAsAnOrbitAroundItself() {
        final var sun = transform.sunPosition(provider.elementsOf(CelestialBody.SUN, 1.0));

        final var position = transform.geocentric(CelestialBody.SUN, null, sun);

        assertThat(position.geocentric()).isEqualTo(sun.geocentric());
        assertThat(position.heliocentricDistance()).isZero();
    }

    @Test
    void moonElementsAreAlreadyGeocentric() {
        final var sun = transform.sunPosition(provider.elementsOf(CelestialBody.SUN, 1.0));
        final var moonElements = provider.elementsOf(CelestialBody.MOON, 1.0);

        final var position = transform.geocentric(CelestialBody.MOON, moonElements, sun);

        assertThat(position.geocentric()).isEqualTo(transform.orbitalPosition(moonElements));
        // perigee to apogee in Earth radii
        assertThat(position.geocentric().getNorm()).isBetween(56.0, 64.0);
    }

    @Test
    void catalogBodiesHaveNoEclipticOrbit() {
        final var sun = transform.sunPosition(provider.elementsOf(CelestialBody.SUN, 1.0));

        assertThatThrownBy(() -> transform.geocentric(CelestialBody.VEGA, null, sun))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
