package io.github.jakubt4.skypointer.service;

import io.github.jakubt4.skypointer.astro.CelestialBody;
import io.github.jakubt4.skypointer.astro.PositionCalculator;
import io.github.jakubt4.skypointer.astro.PositionResult;
import io.github.jakubt4.skypointer.astro.time.SimulationInstant;
import io.github.jakubt4.skypointer.astro.time.TimeMode;
import io.github.jakubt4.skypointer.astro.time.TimeModel;
import io.github.jakubt4.skypointer.dto.PointingRecord;
import io.github.jakubt4.skypointer.error.PositionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Display refresh loop: keeps the pointer on the selected body.
 *
 * <p>The active {@link TrackingSession} can be swapped at runtime through
 * {@link #startTracking}. A {@code @Scheduled} tick re-evaluates the session's body
 * for the current observer, remembers the result for the display and hands a
 * {@link PointingRecord} to {@link PointingTelemetrySender}. Accelerated sessions own
 * their simulated clock, so each tick moves the body along by one step.
 *
 * <p>Session and last position live in one reference. A tick publishes its result only
 * if the session it started from is still current, so a stop or swap during a tick
 * wins over the stale result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrackingService {

    private final PositionCalculator positionCalculator;
    private final TimeModel timeModel;
    private final ObserverLocationService observerLocationService;
    private final PointingTelemetrySender telemetrySender;

    private final AtomicReference<Tracked> tracked = new AtomicReference<>();

    /**
     * Computes the first position of the new session and activates it. The previous
     * session stays active if the first computation fails. Nothing is transmitted here;
     * the next tick sends the first record.
     *
     * @return position at the start of the session
     * @throws PositionException if the session cannot be evaluated
     */
    public PositionResult startTracking(final CelestialBody body, final TimeMode mode) {
        final var timeState = mode instanceof TimeMode.Accelerated ? timeModel.startAcceleration() : null;
        final var session = new TrackingSession(body, mode, timeState);

        // accelerated sessions start at "now"; the first tick takes the first step
        final var first = timeState != null
                ? positionCalculator.computeAt(body, SimulationInstant.of(timeState.current()),
                        observerLocationService.current())
                : positionCalculator.computePosition(body, mode, observerLocationService.current(), null);

        tracked.set(new Tracked(session, first));
        log.info("Tracking [{}] in {} mode", body.displayName(), mode.name());
        return first;
    }

    public void stopTracking() {
        final var previous = tracked.getAndSet(null);
        if (previous != null) {
            log.info("Tracking of [{}] stopped", previous.session().body().displayName());
        }
    }

    public Optional<TrackingSession> activeSession() {
        return Optional.ofNullable(tracked.get()).map(Tracked::session);
    }

    public Optional<PositionResult> currentPosition() {
        return Optional.ofNullable(tracked.get()).map(Tracked::position);
    }

    /**
     * Re-evaluates the active session and transmits the result. Invoked by Spring's
     * scheduler at the configured refresh interval.
     */
    @Scheduled(fixedRateString = "${skypointer.tracking.refresh-interval-ms:1000}")
    public void refresh() {
        final var current = tracked.get();
        if (current == null) {
            log.debug("IDLE, no body selected");
            return;
        }

        final var session = current.session();
        try {
            final var position = positionCalculator.computePosition(
                    session.body(), session.mode(), observerLocationService.current(), session.timeState());
            if (!tracked.compareAndSet(current, new Tracked(session, position))) {
                log.debug("[{}] Session changed during refresh, result dropped", session.body().displayName());
                return;
            }

            log.info("[{}] {}Z alt={} deg, az={} deg",
                    session.body().displayName(),
                    position.instant().utc(),
                    String.format("%.2f", position.altitudeDeg()),
                    String.format("%.2f", position.azimuthDeg()));

            transmit(position);
        } catch (final PositionException e) {
            log.error("[{}] Position error: {}", session.body().displayName(), e.getMessage());
        }
    }

    private void transmit(final PositionResult position) {
        try {
            telemetrySender.send(PointingRecord.of(position));
        } catch (final IOException e) {
            log.error("[{}] Telemetry error: {}", position.body().displayName(), e.getMessage());
        }
    }

    private record Tracked(TrackingSession session, PositionResult position) {
    }
}
