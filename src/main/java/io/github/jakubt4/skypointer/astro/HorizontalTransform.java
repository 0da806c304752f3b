package io.github.jakubt4.skypointer.astro;

import org.hipparchus.util.FastMath;

/**
 * Equatorial to horizontal coordinates for an observer on the Earth's surface.
 */
public final class HorizontalTransform {

    private HorizontalTransform() {
    }

    /**
     * Local sidereal time in hours, in [0, 24).
     *
     * @param sunLongitude      Sun's ecliptic longitude in radians
     * @param universalTime     UT in fractional hours
     * @param observerLongitude degrees, east positive
     */
    public static double localSiderealTime(final double sunLongitude, final double universalTime,
                                           final double observerLongitude) {
        return Angles.reduceHours(FastMath.toDegrees(sunLongitude) / 15.0 + 12.0 + universalTime
                + observerLongitude / 15.0);
    }

    /**
     * @param localSiderealTime hours
     * @param latitude          observer latitude in radians
     */
    public static HorizontalCoordinates toHorizontal(final EquatorialCoordinates equatorial,
                                                     final double localSiderealTime, final double latitude) {
        final var hourAngleHours = Angles.reduceHours(
                localSiderealTime - FastMath.toDegrees(equatorial.rightAscension()) / 15.0);
        final var ha = FastMath.toRadians(hourAngleHours * 15.0);
        final var dec = equatorial.declination();

        final var x = FastMath.cos(ha) * FastMath.cos(dec);
        final var y = FastMath.sin(ha) * FastMath.cos(dec);
        final var z = FastMath.sin(dec);

        final var sinLat = FastMath.sin(latitude);
        final var cosLat = FastMath.cos(latitude);
        final var xa = x * sinLat - z * cosLat;
        final var ya = y;
        final var za = x * cosLat + z * sinLat;

        // +pi puts North at 0 degrees
        final var azimuth = FastMath.toDegrees(FastMath.atan2(ya, xa) + FastMath.PI);
        final var altitude = FastMath.toDegrees(FastMath.atan2(za, FastMath.sqrt(xa * xa + ya * ya)));

        return new HorizontalCoordinates(altitude, Angles.reduceDegrees(azimuth));
    }
}
