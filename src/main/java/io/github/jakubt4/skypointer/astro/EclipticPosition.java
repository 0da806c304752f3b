package io.github.jakubt4.skypointer.astro;

import org.hipparchus.geometry.euclidean.threed.Vector3D;

/**
 * @param geocentric            geocentric ecliptic vector; AU, Earth radii for the Moon
 * @param heliocentricDistance  distance from the Sun in AU, 0 where it has no meaning
 */
public record EclipticPosition(Vector3D geocentric, double heliocentricDistance) {
}
