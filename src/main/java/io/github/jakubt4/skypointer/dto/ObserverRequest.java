package io.github.jakubt4.skypointer.dto;

/**
 * Location fix pushed by the GPS receiver.
 *
 * @param latitudeDeg  degrees, north positive
 * @param longitudeDeg degrees, east positive
 * @param elevationM   metres above sea level, optional
 */
public record ObserverRequest(Double latitudeDeg, Double longitudeDeg, Double elevationM) {
}
