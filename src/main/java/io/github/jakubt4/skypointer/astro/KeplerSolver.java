package io.github.jakubt4.skypointer.astro;

import io.github.jakubt4.skypointer.error.ConvergenceException;
import org.hipparchus.util.FastMath;

/**
 * Newton-Raphson solver for Kepler's equation {@code M = E - e sin E}.
 *
 * <p>The iteration is bounded: elliptic orbits ({@code 0 <= e < 1}) converge in a
 * handful of steps, anything else is rejected before iterating.
 */
public class KeplerSolver {

    public static final int DEFAULT_MAX_ITERATIONS = 50;
    public static final double DEFAULT_TOLERANCE = 1e-4;

    private final int maxIterations;
    private final double tolerance;

    public KeplerSolver() {
        this(DEFAULT_MAX_ITERATIONS, DEFAULT_TOLERANCE);
    }

    public KeplerSolver(final int maxIterations, final double tolerance) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
        }
        if (!(tolerance > 0.0)) {
            throw new IllegalArgumentException("tolerance must be positive: " + tolerance);
        }
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
    }

    /**
     * @param meanAnomaly  M in radians, already reduced into [0, 2pi)
     * @param eccentricity e, must lie in [0, 1)
     * @return eccentric anomaly E in radians
     * @throws ConvergenceException if the input is degenerate or the tolerance is not
     *                              reached within the iteration cap
     */
    public double eccentricAnomaly(final double meanAnomaly, final double eccentricity) {
        if (!Double.isFinite(meanAnomaly) || !Double.isFinite(eccentricity)) {
            throw new ConvergenceException("Non-finite Kepler input", meanAnomaly, eccentricity, 0);
        }
        if (eccentricity < 0.0 || eccentricity >= 1.0) {
            throw new ConvergenceException("Eccentricity outside [0, 1)", meanAnomaly, eccentricity, 0);
        }

        final var e = eccentricity;
        final var m = meanAnomaly;
        var e0 = m + e * FastMath.sin(m) * (1.0 + e * FastMath.cos(m));
        for (var iteration = 1; iteration <= maxIterations; iteration++) {
            final var e1 = e0 - (e0 - e * FastMath.sin(e0) - m) / (1.0 - e * FastMath.cos(e0));
            if (FastMath.abs(e1 - e0) < tolerance) {
                return e1;
            }
            e0 = e1;
        }
        throw new ConvergenceException("Tolerance " + tolerance + " not reached", meanAnomaly, eccentricity, maxIterations);
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public double getTolerance() {
        return tolerance;
    }
}
