package io.github.jakubt4.skypointer.service;

import io.github.jakubt4.skypointer.astro.Observer;
import io.github.jakubt4.skypointer.error.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the observer location. A location fix (GPS receiver) replaces it; without a
 * fix the configured default site is used.
 */
@Slf4j
@Service
public class ObserverLocationService {

    private final Observer defaultObserver;
    private final AtomicReference<Observer> fix = new AtomicReference<>();

    public ObserverLocationService(@Value("${skypointer.observer.latitude-deg:47.5577777}") final double latitudeDeg,
                                   @Value("${skypointer.observer.longitude-deg:8.89888888}") final double longitudeDeg,
                                   @Value("${skypointer.observer.elevation-m:417}") final double elevationM) {
        validate(latitudeDeg, longitudeDeg);
        this.defaultObserver = Observer.ofDegrees(latitudeDeg, longitudeDeg, elevationM);
        log.info("Default observer site lat={} deg, lon={} deg, elevation={} m", latitudeDeg, longitudeDeg, elevationM);
    }

    public Observer current() {
        final var current = fix.get();
        return current != null ? current : defaultObserver;
    }

    public boolean hasFix() {
        return fix.get() != null;
    }

    /**
     * @throws ValidationException if the coordinates are out of range
     */
    public Observer updateFix(final double latitudeDeg, final double longitudeDeg, final double elevationM) {
        validate(latitudeDeg, longitudeDeg);
        final var observer = Observer.ofDegrees(latitudeDeg, longitudeDeg, elevationM);
        fix.set(observer);
        log.info("Location fix acquired, lat={} deg, lon={} deg", latitudeDeg, longitudeDeg);
        return observer;
    }

    public void clearFix() {
        if (fix.getAndSet(null) != null) {
            log.warn("Location fix lost, falling back to default site");
        }
    }

    private static void validate(final double latitudeDeg, final double longitudeDeg) {
        if (!(latitudeDeg >= -90.0 && latitudeDeg <= 90.0)) {
            throw new ValidationException("Latitude must be within [-90, 90] deg, got " + latitudeDeg);
        }
        if (!(longitudeDeg >= -180.0 && longitudeDeg <= 180.0)) {
            throw new ValidationException("Longitude must be within [-180, 180] deg, got " + longitudeDeg);
        }
    }
}
