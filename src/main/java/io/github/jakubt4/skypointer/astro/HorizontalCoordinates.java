package io.github.jakubt4.skypointer.astro;

/**
 * @param altitude degrees above the horizon, in [-90, 90]
 * @param azimuth  degrees from North through East, in [0, 360)
 */
public record HorizontalCoordinates(double altitude, double azimuth) {
}
