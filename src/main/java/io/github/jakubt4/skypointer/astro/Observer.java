package io.github.jakubt4.skypointer.astro;

import org.hipparchus.util.FastMath;

/**
 * Observer location on the Earth's surface.
 *
 * @param latitudeRad  geographic latitude in radians
 * @param longitudeDeg geographic longitude in degrees, east positive
 * @param elevationM   height above sea level in metres; carried along, not used
 */
public record Observer(double latitudeRad, double longitudeDeg, double elevationM) {

    public static Observer ofDegrees(final double latitudeDeg, final double longitudeDeg, final double elevationM) {
        return new Observer(FastMath.toRadians(latitudeDeg), longitudeDeg, elevationM);
    }

    public double latitudeDeg() {
        return FastMath.toDegrees(latitudeRad);
    }
}
