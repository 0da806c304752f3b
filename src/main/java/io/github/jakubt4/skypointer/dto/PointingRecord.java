package io.github.jakubt4.skypointer.dto;

import io.github.jakubt4.skypointer.astro.PositionResult;

import java.util.Locale;

/**
 * Pointing command for the downstream motor controller.
 *
 * <p>Wire format is a single ASCII line {@code <Name, Altitude, Azimuth>} with both
 * angles in degrees rounded to two decimals, e.g. {@code <Mars, 14.48, 214.99>}. The name
 * is the body's {@link io.github.jakubt4.skypointer.astro.CelestialBody#menuName() menu name},
 * e.g. {@code <Sonne, -64.69, 17.49>}.
 */
public record PointingRecord(String name, double altitudeDeg, double azimuthDeg) {

    public static PointingRecord of(final PositionResult position) {
        return new PointingRecord(position.body().menuName(), position.altitudeDeg(), position.azimuthDeg());
    }

    public String encode() {
        return String.format(Locale.ROOT, "<%s, %.2f, %.2f>", name, altitudeDeg, azimuthDeg);
    }
}
