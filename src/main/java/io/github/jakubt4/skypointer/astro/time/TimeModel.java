package io.github.jakubt4.skypointer.astro.time;

import io.github.jakubt4.skypointer.error.ValidationException;
import lombok.RequiredArgsConstructor;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Resolves a {@link TimeMode} to the instant a query is evaluated at. Never blocks.
 */
@RequiredArgsConstructor
public class TimeModel {

    private final Clock clock;

    /**
     * @param state simulated clock; required for {@link TimeMode.Accelerated}, ignored otherwise
     * @throws ValidationException if an accelerated query has no state to advance
     */
    public SimulationInstant resolve(final TimeMode mode, final TimeState state) {
        if (mode instanceof TimeMode.Live) {
            return SimulationInstant.of(now());
        }
        if (mode instanceof TimeMode.Fixed fixed) {
            return SimulationInstant.of(LocalDateTime.of(fixed.date(), fixed.time()));
        }
        if (mode instanceof TimeMode.Accelerated accelerated) {
            if (state == null) {
                throw new ValidationException("Accelerated mode needs a time state to advance");
            }
            return SimulationInstant.of(state.advance(Duration.ofMinutes(accelerated.stepMinutes())));
        }
        throw new IllegalArgumentException("Unsupported time mode: " + mode);
    }

    /**
     * A fresh simulated clock set to the current real time.
     */
    public TimeState startAcceleration() {
        return TimeState.startingNow(clock);
    }

    public LocalDateTime now() {
        return LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
    }
}
