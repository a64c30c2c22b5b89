package com.logimatrix.tracking.service;

import com.logimatrix.tracking.config.TrackingProperties;
import com.logimatrix.tracking.dto.EtaConfidence;
import com.logimatrix.tracking.dto.EtaEstimate;
import com.logimatrix.tracking.dto.FixRecord;
import com.logimatrix.tracking.dto.SpeedSource;
import com.logimatrix.tracking.exception.NoLocationException;
import com.logimatrix.tracking.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EtaServiceTest {

    private static final Instant T0 = Instant.parse("2024-01-01T12:00:00Z");

    private PositionStore positionStore;
    private MutableClock clock;
    private EtaService etaService;

    @BeforeEach
    void setUp() {
        positionStore = mock(PositionStore.class);
        clock = new MutableClock(T0.plusSeconds(5));
        etaService = new EtaService(positionStore, new TrackingProperties(), clock);
    }

    @Test
    void recentSamplesDriveTheEstimate() {
        FixRecord latest = sample(58.0, 0);
        when(positionStore.getLatest("V")).thenReturn(Optional.of(latest));
        when(positionStore.recentSamples(eq("V"), eq(T0), any(Duration.class)))
            .thenReturn(List.of(sample(60.0, -20), sample(62.0, -10), latest));

        EtaEstimate eta = etaService.forVehicle("V", 0.0, 1.0);

        assertThat(eta.remainingDistanceKm()).isCloseTo(111.19, within(0.01));
        assertThat(eta.speedEstimateKmh()).isCloseTo(60.0, within(0.5));
        assertThat(eta.etaSeconds()).isCloseTo(6671L, within(30L));
        assertThat(eta.speedSource()).isEqualTo(SpeedSource.RECENT_SAMPLES);
        assertThat(eta.sampleCount()).isEqualTo(3);
        assertThat(eta.confidence()).isEqualTo(EtaConfidence.HIGH);
        assertThat(eta.estimatedArrival()).isEqualTo(T0.plusSeconds(eta.etaSeconds()));
    }

    @Test
    void weightedMeanFavoursRecentSamples() {
        double mean = EtaService.weightedMean(List.of(sample(40.0, -20), sample(40.0, -10), sample(80.0, 0)), 0.3);

        assertThat(mean).isCloseTo(52.0, within(0.001));
    }

    @Test
    void fallsBackToLastKnownSpeedWithClamp() {
        FixRecord latest = sample(2.0, 0);
        when(positionStore.getLatest("V")).thenReturn(Optional.of(latest));
        when(positionStore.recentSamples(eq("V"), eq(T0), any(Duration.class))).thenReturn(List.of(latest));

        EtaEstimate eta = etaService.forVehicle("V", 0.0, 1.0);

        assertThat(eta.speedSource()).isEqualTo(SpeedSource.LAST_KNOWN);
        assertThat(eta.speedEstimateKmh()).isEqualTo(5.0);
        assertThat(eta.confidence()).isEqualTo(EtaConfidence.MEDIUM);
        assertThat(eta.sampleCount()).isZero();
    }

    @Test
    void fallsBackToDefaultSpeedWithLowConfidence() {
        FixRecord latest = FixRecord.of("acme", "V", 0.0, 0.0, T0);
        when(positionStore.getLatestForShipment("SH-1")).thenReturn(Optional.of(latest));
        when(positionStore.recentSamples(eq("V"), eq(T0), any(Duration.class))).thenReturn(List.of());

        EtaEstimate eta = etaService.forShipment("SH-1", 0.0, 1.0);

        assertThat(eta.speedSource()).isEqualTo(SpeedSource.DEFAULT);
        assertThat(eta.speedEstimateKmh()).isEqualTo(50.0);
        assertThat(eta.etaSeconds()).isCloseTo(8006L, within(2L));
        assertThat(eta.confidence()).isEqualTo(EtaConfidence.LOW);
    }

    @Test
    void olderPositionLowersConfidence() {
        FixRecord latest = sample(60.0, 0);
        when(positionStore.getLatest("V")).thenReturn(Optional.of(latest));
        when(positionStore.recentSamples(eq("V"), eq(T0), any(Duration.class)))
            .thenReturn(List.of(sample(60.0, -20), sample(60.0, -10), latest));
        clock.set(T0.plus(Duration.ofMinutes(3)));

        assertThat(etaService.forVehicle("V", 0.0, 1.0).confidence()).isEqualTo(EtaConfidence.MEDIUM);
    }

    @Test
    void noHotPositionMeansNoLocation() {
        when(positionStore.getLatest("GHOST")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> etaService.forVehicle("GHOST", 0.0, 1.0))
            .isInstanceOf(NoLocationException.class);
    }

    @Test
    void invalidDestinationIsRejected() {
        when(positionStore.getLatest("V")).thenReturn(Optional.of(sample(60.0, 0)));

        assertThatThrownBy(() -> etaService.forVehicle("V", 95.0, 1.0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static FixRecord sample(double speed, int offsetSeconds) {
        return FixRecord.of("acme", "V", 0.0, 0.0, T0.plusSeconds(offsetSeconds)).withSpeed(speed);
    }
}
