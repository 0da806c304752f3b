package io.github.jakubt4.skypointer.dto;

import io.github.jakubt4.skypointer.astro.Observer;

/**
 * @param source {@code "FIX"} for a received location, {@code "DEFAULT"} for the configured site
 */
public record ObserverResponse(double latitudeDeg, double longitudeDeg, double elevationM, String source) {

    public static ObserverResponse of(final Observer observer, final boolean fix) {
        return new ObserverResponse(observer.latitudeDeg(), observer.longitudeDeg(), observer.elevationM(),
                fix ? "FIX" : "DEFAULT");
    }
}
