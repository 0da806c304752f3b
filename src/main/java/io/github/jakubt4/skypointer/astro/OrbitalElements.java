package io.github.jakubt4.skypointer.astro;

/**
 * Keplerian elements of one body at one day count.
 *
 * @param longitudeOfNode      N, degrees
 * @param inclination          i, degrees
 * @param argumentOfPerihelion w, degrees
 * @param semiMajorAxis        a, AU (Earth radii for the Moon)
 * @param eccentricity         e
 * @param meanAnomaly          M, degrees
 */
public record OrbitalElements(double longitudeOfNode,
                              double inclination,
                              double argumentOfPerihelion,
                              double semiMajorAxis,
                              double eccentricity,
                              double meanAnomaly) {

    /**
     * Same elements with every angle reduced into [0, 360).
     */
    public OrbitalElements reduced() {
        return new OrbitalElements(
                Angles.reduceDegrees(longitudeOfNode),
                Angles.reduceDegrees(inclination),
                Angles.reduceDegrees(argumentOfPerihelion),
                semiMajorAxis,
                eccentricity,
                Angles.reduceDegrees(meanAnomaly));
    }
}
