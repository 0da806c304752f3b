package io.github.jakubt4.skypointer.astro;

import org.hipparchus.util.MathUtils;

final class Angles {

    private Angles() {
    }

    static double reduceDegrees(final double degrees) {
        return reduce(degrees, 360.0);
    }

    static double reduceRadians(final double radians) {
        return reduce(radians, MathUtils.TWO_PI);
    }

    static double reduceHours(final double hours) {
        return reduce(hours, 24.0);
    }

    // MathUtils.reduce can round up to exactly one period for tiny negative input
    private static double reduce(final double value, final double period) {
        final var reduced = MathUtils.reduce(value, period, 0.0);
        return reduced >= period ? 0.0 : reduced;
    }
}
