package io.github.jakubt4.skypointer.astro.time;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Simulated UTC clock of an accelerated session. Owned by the caller that started
 * the session; advances are serialized because they are read-modify-write.
 */
public final class TimeState {

    private LocalDateTime utc;

    private TimeState(final LocalDateTime utc) {
        this.utc = Objects.requireNonNull(utc, "utc");
    }

    public static TimeState startingAt(final LocalDateTime utc) {
        return new TimeState(utc);
    }

    public static TimeState startingNow(final Clock clock) {
        return new TimeState(LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC));
    }

    public synchronized LocalDateTime current() {
        return utc;
    }

    /**
     * Moves the simulated clock forward and returns the new value.
     */
    public synchronized LocalDateTime advance(final Duration step) {
        utc = utc.plus(step);
        return utc;
    }

    @Override
    public synchronized String toString() {
        return "TimeState[" + utc + "Z]";
    }
}
