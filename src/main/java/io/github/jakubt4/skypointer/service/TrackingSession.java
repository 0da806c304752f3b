package io.github.jakubt4.skypointer.service;

import io.github.jakubt4.skypointer.astro.CelestialBody;
import io.github.jakubt4.skypointer.astro.time.TimeMode;
import io.github.jakubt4.skypointer.astro.time.TimeState;

/**
 * @param timeState simulated clock of an accelerated session, {@code null} for live and fixed sessions
 */
public record TrackingSession(CelestialBody body, TimeMode mode, TimeState timeState) {
}
