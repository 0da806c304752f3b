package io.github.jakubt4.skypointer.astro.time;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * A UTC instant expressed the way the orbital model consumes it.
 *
 * @param utc           UTC date and time
 * @param dayNumber     {@code d}: whole days since 2000-01-01 plus one, plus the fraction of the UTC day
 * @param universalTime UT in fractional hours, in [0, 24)
 */
public record SimulationInstant(LocalDateTime utc, double dayNumber, double universalTime) {

    public static final LocalDate EPOCH = LocalDate.of(2000, 1, 1);

    private static final double SECONDS_PER_DAY = 86_400.0;
    private static final double NANOS_PER_SECOND = 1e9;

    public static SimulationInstant of(final LocalDateTime utc) {
        final var wholeDays = ChronoUnit.DAYS.between(EPOCH, utc.toLocalDate()) + 1;
        final var secondsOfDay = utc.toLocalTime().toNanoOfDay() / NANOS_PER_SECOND;
        final var fraction = secondsOfDay / SECONDS_PER_DAY;
        return new SimulationInstant(utc, wholeDays + fraction, fraction * 24.0);
    }
}
