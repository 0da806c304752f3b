package io.github.jakubt4.skypointer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * SkyPointer, pointing controller for a motorized sky pointer.
 *
 * <p>Computes the altitude and azimuth of the Sun, Moon, planets and a small catalog
 * of bright stars and galaxies for the observer's location, re-evaluates the tracked
 * body on a fixed cadence and streams {@code <Name, Altitude, Azimuth>} records over
 * UDP to the pointing hardware.
 *
 * @see io.github.jakubt4.skypointer.astro.PositionCalculator
 * @see io.github.jakubt4.skypointer.service.TrackingService
 */
@SpringBootApplication
@EnableScheduling
@EnableRetry
public class SkyPointerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SkyPointerApplication.class, args);
    }
}
