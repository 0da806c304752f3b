package io.github.jakubt4.skypointer.dto;

import io.github.jakubt4.skypointer.astro.time.TimeMode;
import io.github.jakubt4.skypointer.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TrackingRequestTest {

    @Test
    void missingModeMeansLive() {
        assertThat(new TrackingRequest("Mars", null, null, null, null).toTimeMode(25))
                .isInstanceOf(TimeMode.Live.class);
    }

    @Test
    void fixedModeParsesDateAndTime() {
        final var mode = new TrackingRequest("Mars", "fixed", "24.12.2019", "18:30", null).toTimeMode(25);

        assertThat(mode).isInstanceOfSatisfying(TimeMode.Fixed.class,
                fixed -> assertThat(fixed.date()).isEqualTo(LocalDate.of(2019, 12, 24)));
    }

    @Test
    void acceleratedModeFallsBackToConfiguredStep() {
        assertThat(new TrackingRequest("Mars", "ACCELERATED", null, null, null).toTimeMode(25))
                .isEqualTo(new TimeMode.Accelerated(25));
        assertThat(new TrackingRequest("Mars", "ACCELERATED", null, null, 5).toTimeMode(25))
                .isEqualTo(new TimeMode.Accelerated(5));
    }

    @Test
    void unknownModeIsRejected() {
        assertThatThrownBy(() -> new TrackingRequest("Mars", "WARP", null, null, null).toTimeMode(25))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("WARP");
    }

    @Test
    void fixedModeWithoutDateIsRejected() {
        assertThatThrownBy(() -> new TrackingRequest("Mars", "FIXED", null, "12:00", null).toTimeMode(25))
                .isInstanceOf(ValidationException.class);
    }
}
