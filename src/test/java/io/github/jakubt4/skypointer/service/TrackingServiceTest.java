package io.github.jakubt4.skypointer.service;

import io.github.jakubt4.skypointer.astro.CelestialBody;
import io.github.jakubt4.skypointer.astro.Observer;
import io.github.jakubt4.skypointer.astro.PositionCalculator;
import io.github.jakubt4.skypointer.astro.time.TimeMode;
import io.github.jakubt4.skypointer.dto.PointingRecord;
import io.github.jakubt4.skypointer.error.ValidationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.mock.mockito.SpyBean;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@SpringBootTest(properties = "skypointer.tracking.refresh-interval-ms=3600000")
class TrackingServiceTest {

    @MockBean
    private PointingTelemetrySender telemetrySender;

    @SpyBean
    private PositionCalculator positionCalculator;

    @Autowired
    private TrackingService trackingService;

    @Autowired
    private ObserverLocationService observerLocationService;

    @BeforeEach
    void resetMock() {
        Mockito.clearInvocations(telemetrySender);
    }

    @AfterEach
    void stop() {
        trackingService.stopTracking();
        observerLocationService.clearFix();
    }

    @Test
    void refreshIsNoOpWhileIdle() {
        trackingService.refresh();

        verifyNoInteractions(telemetrySender);
        assertThat(trackingService.currentPosition()).isEmpty();
    }

    @Test
    void startTrackingPublishesFirstPositionAndLeavesTransmissionToTheTick() throws Exception {
        final var first = trackingService.startTracking(CelestialBody.SIRIUS, TimeMode.live());

        assertThat(trackingService.currentPosition()).contains(first);
        assertThat(trackingService.activeSession()).hasValueSatisfying(session ->
                assertThat(session.body()).isEqualTo(CelestialBody.SIRIUS));
        verifyNoInteractions(telemetrySender);

        trackingService.refresh();

        final var captor = ArgumentCaptor.forClass(PointingRecord.class);
        verify(telemetrySender).send(captor.capture());
        assertThat(captor.getValue().name()).isEqualTo("Sirius");
    }

    @Test
    void acceleratedSessionAdvancesOneStepPerRefresh() throws Exception {
        final var first = trackingService.startTracking(CelestialBody.MARS, new TimeMode.Accelerated(25));
        final LocalDateTime start = first.instant().utc();

        for (var i = 0; i < 4; i++) {
            trackingService.refresh();
        }

        assertThat(trackingService.currentPosition()).hasValueSatisfying(position ->
                assertThat(position.instant().utc()).isEqualTo(start.plusMinutes(4 * 25)));
        verify(telemetrySender, times(4)).send(any(PointingRecord.class));
    }

    @Test
    void fixedSessionUsesObserverFix() {
        final var mode = TimeMode.Fixed.parse("01.01.2000", "00:00");
        final var atDefaultSite = trackingService.startTracking(CelestialBody.SUN, mode);

        observerLocationService.updateFix(-33.9249, 18.4241, 12.0);
        trackingService.refresh();

        assertThat(trackingService.currentPosition()).hasValueSatisfying(position -> {
            assertThat(position.raRad()).isEqualTo(atDefaultSite.raRad());
            assertThat(position.altitudeDeg()).isGreaterThan(atDefaultSite.altitudeDeg());
        });
    }

    @Test
    void invalidFixedInputLeavesActiveSessionUntouched() {
        trackingService.startTracking(CelestialBody.VEGA, TimeMode.live());

        assertThatThrownBy(() -> trackingService.startTracking(CelestialBody.MARS, TimeMode.Fixed.of(31, 4, 2020, 0, 0)))
                .isInstanceOf(ValidationException.class);

        assertThat(trackingService.activeSession()).hasValueSatisfying(session ->
                assertThat(session.body()).isEqualTo(CelestialBody.VEGA));
    }

    @Test
    void stopTrackingClearsSessionAndPosition() {
        trackingService.startTracking(CelestialBody.MOON, TimeMode.live());

        trackingService.stopTracking();
        Mockito.clearInvocations(telemetrySender);
        trackingService.refresh();

        assertThat(trackingService.activeSession()).isEmpty();
        assertThat(trackingService.currentPosition()).isEmpty();
        verifyNoInteractions(telemetrySender);
    }

    @Test
    void stopDuringRefreshDropsTheResult() {
        trackingService.startTracking(CelestialBody.MARS, TimeMode.live());
        doAnswer(invocation -> {
            trackingService.stopTracking();
            return invocation.callRealMethod();
        }).when(positionCalculator).computePosition(any(CelestialBody.class), any(TimeMode.class), any(Observer.class), any());

        trackingService.refresh();

        assertThat(trackingService.activeSession()).isEmpty();
        assertThat(trackingService.currentPosition()).isEmpty();
        verifyNoInteractions(telemetrySender);
    }

    @Test
    void sessionSwappedDuringRefreshKeepsTheNewBody() {
        trackingService.startTracking(CelestialBody.MARS, TimeMode.live());
        doAnswer(invocation -> {
            trackingService.startTracking(CelestialBody.SIRIUS, TimeMode.live());
            return invocation.callRealMethod();
        }).doCallRealMethod()
                .when(positionCalculator).computePosition(any(CelestialBody.class), any(TimeMode.class), any(Observer.class), any());

        trackingService.refresh();

        assertThat(trackingService.activeSession()).hasValueSatisfying(session ->
                assertThat(session.body()).isEqualTo(CelestialBody.SIRIUS));
        assertThat(trackingService.currentPosition()).hasValueSatisfying(position ->
                assertThat(position.body()).isEqualTo(CelestialBody.SIRIUS));
        verifyNoInteractions(telemetrySender);
    }
}
