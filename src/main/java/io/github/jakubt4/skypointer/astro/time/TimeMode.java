package io.github.jakubt4.skypointer.astro.time;

import io.github.jakubt4.skypointer.error.ValidationException;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;

/**
 * How the instant of a position query is chosen.
 */
public sealed interface TimeMode permits TimeMode.Live, TimeMode.Fixed, TimeMode.Accelerated {

    static TimeMode live() {
        return new Live();
    }

    /**
     * Upper-case label used in logs and the REST API.
     */
    String name();

    /**
     * Current wall-clock time.
     */
    record Live() implements TimeMode {

        @Override
        public String name() {
            return "LIVE";
        }
    }

    /**
     * A user-supplied UTC date and time of day.
     */
    record Fixed(LocalDate date, LocalTime time) implements TimeMode {

        private static final DateTimeFormatter DATE_FORMAT =
                DateTimeFormatter.ofPattern("d.M.uuuu").withResolverStyle(ResolverStyle.STRICT);
        private static final DateTimeFormatter TIME_FORMAT =
                DateTimeFormatter.ofPattern("H:mm").withResolverStyle(ResolverStyle.STRICT);

        public Fixed {
            if (date == null || time == null) {
                throw new ValidationException("Fixed mode needs both a date and a time");
            }
        }

        /**
         * @throws ValidationException if the values do not form a real calendar date and time
         */
        public static Fixed of(final int day, final int month, final int year, final int hour, final int minute) {
            try {
                return new Fixed(LocalDate.of(year, month, day), LocalTime.of(hour, minute));
            } catch (final DateTimeException e) {
                throw new ValidationException("Invalid date/time %02d.%02d.%04d %02d:%02d: %s"
                        .formatted(day, month, year, hour, minute, e.getMessage()), e);
            }
        }

        /**
         * Parses {@code dd.MM.yyyy} and {@code HH:mm}.
         *
         * @throws ValidationException on malformed or out-of-calendar input
         */
        public static Fixed parse(final String date, final String time) {
            if (date == null || time == null) {
                throw new ValidationException("Fixed mode needs both a date and a time");
            }
            final LocalDate parsedDate;
            try {
                parsedDate = LocalDate.parse(date.trim(), DATE_FORMAT);
            } catch (final DateTimeException e) {
                throw new ValidationException("Invalid date '" + date + "', expected dd.MM.yyyy", e);
            }
            final LocalTime parsedTime;
            try {
                parsedTime = LocalTime.parse(time.trim(), TIME_FORMAT);
            } catch (final DateTimeException e) {
                throw new ValidationException("Invalid time '" + time + "', expected HH:mm", e);
            }
            return new Fixed(parsedDate, parsedTime);
        }

        @Override
        public String name() {
            return "FIXED";
        }
    }

    /**
     * Simulated clock advancing by {@code stepMinutes} on every query.
     */
    record Accelerated(int stepMinutes) implements TimeMode {

        public Accelerated {
            if (stepMinutes <= 0) {
                throw new ValidationException("Accelerated step must be positive, got " + stepMinutes + " min");
            }
        }

        @Override
        public String name() {
            return "ACCELERATED";
        }
    }
}
