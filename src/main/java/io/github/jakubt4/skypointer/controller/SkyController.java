package io.github.jakubt4.skypointer.controller;

import io.github.jakubt4.skypointer.astro.BodyCategory;
import io.github.jakubt4.skypointer.astro.CelestialBody;
import io.github.jakubt4.skypointer.astro.PositionCalculator;
import io.github.jakubt4.skypointer.astro.time.TimeMode;
import io.github.jakubt4.skypointer.astro.time.TimeModel;
import io.github.jakubt4.skypointer.dto.ObserverRequest;
import io.github.jakubt4.skypointer.dto.ObserverResponse;
import io.github.jakubt4.skypointer.dto.PositionResponse;
import io.github.jakubt4.skypointer.dto.TrackingRequest;
import io.github.jakubt4.skypointer.dto.TrackingResponse;
import io.github.jakubt4.skypointer.error.ConvergenceException;
import io.github.jakubt4.skypointer.error.PositionException;
import io.github.jakubt4.skypointer.error.UnknownBodyException;
import io.github.jakubt4.skypointer.error.ValidationException;
import io.github.jakubt4.skypointer.service.ObserverLocationService;
import io.github.jakubt4.skypointer.service.TrackingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST surface of the pointer: body catalog, one-shot position queries, tracking
 * control and location fixes.
 */
@Slf4j
@RestController
@RequestMapping("/api/sky")
public class SkyController {

    private final PositionCalculator positionCalculator;
    private final TimeModel timeModel;
    private final TrackingService trackingService;
    private final ObserverLocationService observerLocationService;
    private final int defaultStepMinutes;

    public SkyController(final PositionCalculator positionCalculator,
                         final TimeModel timeModel,
                         final TrackingService trackingService,
                         final ObserverLocationService observerLocationService,
                         @Value("${skypointer.tracking.accelerated-step-minutes:25}") final int defaultStepMinutes) {
        this.positionCalculator = positionCalculator;
        this.timeModel = timeModel;
        this.trackingService = trackingService;
        this.observerLocationService = observerLocationService;
        this.defaultStepMinutes = defaultStepMinutes;
    }

    @GetMapping("/bodies")
    public Map<BodyCategory, List<String>> bodies() {
        final var result = new LinkedHashMap<BodyCategory, List<String>>();
        CelestialBody.byCategory().forEach((category, members) ->
                result.put(category, members.stream().map(CelestialBody::displayName).toList()));
        return result;
    }

    /**
     * One-shot position query. An accelerated query starts a throwaway clock at the
     * current time and advances it once.
     */
    @GetMapping("/position")
    public PositionResponse position(@RequestParam final String body,
                                     @RequestParam(required = false) final String mode,
                                     @RequestParam(required = false) final String date,
                                     @RequestParam(required = false) final String time,
                                     @RequestParam(required = false) final Integer stepMinutes) {
        final var celestialBody = CelestialBody.fromId(body);
        final var timeMode = new TrackingRequest(body, mode, date, time, stepMinutes).toTimeMode(defaultStepMinutes);
        final var timeState = timeMode instanceof TimeMode.Accelerated ? timeModel.startAcceleration() : null;
        final var result = positionCalculator.computePosition(
                celestialBody, timeMode, observerLocationService.current(), timeState);
        return PositionResponse.of(result);
    }

    /**
     * Selects the body the pointer follows.
     *
     * @return {@code 200 OK} with ACTIVE status on success, {@code 400 Bad Request} on
     *         invalid input, {@code 422 Unprocessable Entity} if the position cannot be solved
     */
    @PostMapping("/tracking")
    public ResponseEntity<TrackingResponse> startTracking(@RequestBody final TrackingRequest request) {
        if (request.body() == null || request.body().isBlank()) {
            return ResponseEntity.badRequest()
                    .body(new TrackingResponse(null, "REJECTED", "Body is required"));
        }

        try {
            final var body = CelestialBody.fromId(request.body());
            final var mode = request.toTimeMode(defaultStepMinutes);
            final var first = trackingService.startTracking(body, mode);
            return ResponseEntity.ok(new TrackingResponse(body.displayName(), "ACTIVE",
                    "Tracking in %s mode, alt=%.2f deg, az=%.2f deg"
                            .formatted(mode.name(), first.altitudeDeg(), first.azimuthDeg())));
        } catch (final PositionException e) {
            log.error("Failed to start tracking [{}]: {}", request.body(), e.getMessage());
            return ResponseEntity.status(statusOf(e))
                    .body(new TrackingResponse(request.body(), "REJECTED", e.getMessage()));
        }
    }

    @GetMapping("/tracking")
    public ResponseEntity<PositionResponse> trackedPosition() {
        return trackingService.currentPosition()
                .map(PositionResponse::of)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @DeleteMapping("/tracking")
    public TrackingResponse stopTracking() {
        trackingService.stopTracking();
        return new TrackingResponse(null, "IDLE", "Tracking stopped");
    }

    @GetMapping("/observer")
    public ObserverResponse observer() {
        return ObserverResponse.of(observerLocationService.current(), observerLocationService.hasFix());
    }

    @PutMapping("/observer")
    public ObserverResponse updateObserver(@RequestBody final ObserverRequest request) {
        if (request.latitudeDeg() == null || request.longitudeDeg() == null) {
            throw new ValidationException("latitudeDeg and longitudeDeg are required");
        }
        final var elevation = request.elevationM() != null ? request.elevationM() : 0.0;
        final var observer = observerLocationService.updateFix(request.latitudeDeg(), request.longitudeDeg(), elevation);
        return ObserverResponse.of(observer, true);
    }

    @DeleteMapping("/observer")
    public ObserverResponse clearObserver() {
        observerLocationService.clearFix();
        return ObserverResponse.of(observerLocationService.current(), false);
    }

    @ExceptionHandler(PositionException.class)
    public ResponseEntity<TrackingResponse> handlePositionException(final PositionException e) {
        log.warn("Request rejected: {}", e.getMessage());
        final var body = e instanceof UnknownBodyException unknown ? unknown.getIdentifier() : null;
        return ResponseEntity.status(statusOf(e)).body(new TrackingResponse(body, "REJECTED", e.getMessage()));
    }

    private static HttpStatus statusOf(final PositionException e) {
        return e instanceof ConvergenceException ? HttpStatus.UNPROCESSABLE_ENTITY : HttpStatus.BAD_REQUEST;
    }
}
