package io.github.jakubt4.skypointer.astro;

import org.hipparchus.geometry.euclidean.threed.Vector3D;

/**
 * Geocentric ecliptic position of the Sun.
 *
 * @param eclipticLongitude longitude in radians, in [0, 2pi)
 * @param distance          Earth-Sun distance in AU
 * @param geocentric        ecliptic vector (xs, ys, 0) in AU
 */
public record SunPosition(double eclipticLongitude, double distance, Vector3D geocentric) {
}
