package io.github.jakubt4.skypointer.astro;

import io.github.jakubt4.skypointer.astro.time.SimulationInstant;

/**
 * Topocentric position of one body at one instant.
 *
 * @param body                   the body
 * @param altitudeDeg            degrees, in [-90, 90]
 * @param azimuthDeg             degrees from North, in [0, 360)
 * @param raRad                  right ascension in radians
 * @param decRad                 declination in radians
 * @param geocentricDistanceAu   Earth distance in AU; Earth-Sun distance for the Sun, 0 for catalog objects
 * @param heliocentricDistanceAu Sun distance in AU for planets, 0 otherwise
 * @param instant                simulated instant the position refers to
 */
public record PositionResult(CelestialBody body,
                             double altitudeDeg,
                             double azimuthDeg,
                             double raRad,
                             double decRad,
                             double geocentricDistanceAu,
                             double heliocentricDistanceAu,
                             SimulationInstant instant) {
}
