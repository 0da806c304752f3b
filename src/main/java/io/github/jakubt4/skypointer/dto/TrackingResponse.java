package io.github.jakubt4.skypointer.dto;

/**
 * Outcome of a tracking command.
 *
 * @param body    body the command was for (may be {@code null} on early rejection)
 * @param status  {@code "ACTIVE"}, {@code "IDLE"} or {@code "REJECTED"}
 * @param message human-readable detail about the result
 */
public record TrackingResponse(String body, String status, String message) {
}
