package io.github.jakubt4.skypointer.dto;

import io.github.jakubt4.skypointer.astro.PositionResult;

import java.time.LocalDateTime;

public record PositionResponse(String body,
                               String category,
                               LocalDateTime utc,
                               double altitudeDeg,
                               double azimuthDeg,
                               double raRad,
                               double decRad,
                               double geocentricDistanceAu,
                               double heliocentricDistanceAu) {

    public static PositionResponse of(final PositionResult result) {
        return new PositionResponse(
                result.body().displayName(),
                result.body().category().name(),
                result.instant().utc(),
                result.altitudeDeg(),
                result.azimuthDeg(),
                result.raRad(),
                result.decRad(),
                result.geocentricDistanceAu(),
                result.heliocentricDistanceAu());
    }
}
