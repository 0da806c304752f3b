package io.github.jakubt4.skypointer.astro;

/**
 * @param rightAscension radians, in [0, 2pi)
 * @param declination    radians, in [-pi/2, pi/2]
 * @param distance       geocentric distance, 0 for catalog objects
 */
public record EquatorialCoordinates(double rightAscension, double declination, double distance) {

    public static EquatorialCoordinates ofCatalog(final CelestialBody body) {
        return new EquatorialCoordinates(body.rightAscensionRad(), body.declinationRad(), 0.0);
    }

    public EquatorialCoordinates withDistance(final double newDistance) {
        return new EquatorialCoordinates(rightAscension, declination, newDistance);
    }
}
