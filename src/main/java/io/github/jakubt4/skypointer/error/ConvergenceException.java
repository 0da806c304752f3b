package io.github.jakubt4.skypointer.error;

import lombok.Getter;

/**
 * Kepler's equation could not be solved to tolerance. Raised for eccentricities
 * outside [0, 1), non-finite input, or when the iteration cap is exhausted.
 */
@Getter
public class ConvergenceException extends PositionException {

    private final double meanAnomaly;
    private final double eccentricity;
    private final int iterations;

    public ConvergenceException(final String reason, final double meanAnomaly,
                                final double eccentricity, final int iterations) {
        super("%s (M=%s rad, e=%s, iterations=%d)".formatted(reason, meanAnomaly, eccentricity, iterations));
        this.meanAnomaly = meanAnomaly;
        this.eccentricity = eccentricity;
        this.iterations = iterations;
    }
}
