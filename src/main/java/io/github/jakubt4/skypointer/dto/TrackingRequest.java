package io.github.jakubt4.skypointer.dto;

import io.github.jakubt4.skypointer.astro.time.TimeMode;
import io.github.jakubt4.skypointer.error.ValidationException;

import java.util.Locale;

/**
 * Inbound request selecting a body and a time mode.
 *
 * @param body        body identifier (e.g. "Mars", "ALPHA_CENTAURI_A", "Andromeda")
 * @param mode        {@code LIVE} (default), {@code FIXED} or {@code ACCELERATED}
 * @param date        {@code dd.MM.yyyy}, FIXED only
 * @param time        {@code HH:mm} UTC, FIXED only
 * @param stepMinutes simulated minutes per refresh, ACCELERATED only; falls back to the configured step
 */
public record TrackingRequest(String body, String mode, String date, String time, Integer stepMinutes) {

    /**
     * @throws ValidationException for an unknown mode or unusable FIXED/ACCELERATED parameters
     */
    public TimeMode toTimeMode(final int defaultStepMinutes) {
        final var normalized = mode == null || mode.isBlank() ? "LIVE" : mode.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "LIVE" -> TimeMode.live();
            case "FIXED" -> TimeMode.Fixed.parse(date, time);
            case "ACCELERATED" -> new TimeMode.Accelerated(stepMinutes != null ? stepMinutes : defaultStepMinutes);
            default -> throw new ValidationException(
                    "Unknown time mode '" + mode + "', expected LIVE, FIXED or ACCELERATED");
        };
    }
}
