package io.github.jakubt4.skypointer.service;

import io.github.jakubt4.skypointer.error.ValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ObserverLocationServiceTest {

    private final ObserverLocationService service = new ObserverLocationService(47.5577777, 8.89888888, 417.0);

    @Test
    void usesDefaultSiteUntilFixArrives() {
        assertThat(service.hasFix()).isFalse();
        assertThat(service.current().latitudeRad()).isCloseTo(Math.toRadians(47.5577777), within(1e-12));
        assertThat(service.current().longitudeDeg()).isEqualTo(8.89888888);
        assertThat(service.current().elevationM()).isEqualTo(417.0);
    }

    @Test
    void fixReplacesDefaultAndCanBeCleared() {
        service.updateFix(-33.9249, 18.4241, 12.0);

        assertThat(service.hasFix()).isTrue();
        assertThat(service.current().latitudeDeg()).isCloseTo(-33.9249, within(1e-9));
        assertThat(service.current().longitudeDeg()).isEqualTo(18.4241);

        service.clearFix();

        assertThat(service.hasFix()).isFalse();
        assertThat(service.current().longitudeDeg()).isEqualTo(8.89888888);
    }

    @Test
    void outOfRangeFixIsRejectedAndKeepsPreviousLocation() {
        assertThatThrownBy(() -> service.updateFix(91.0, 0.0, 0.0)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.updateFix(0.0, 180.5, 0.0)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.updateFix(Double.NaN, 0.0, 0.0)).isInstanceOf(ValidationException.class);

        assertThat(service.hasFix()).isFalse();
    }

    @Test
    void invalidDefaultSiteFailsAtStartup() {
        assertThatThrownBy(() -> new ObserverLocationService(120.0, 0.0, 0.0))
                .isInstanceOf(ValidationException.class);
    }
}
