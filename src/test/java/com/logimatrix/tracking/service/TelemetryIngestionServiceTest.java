package com.logimatrix.tracking.service;

import com.logimatrix.tracking.bus.InMemorySubscriptionBus;
import com.logimatrix.tracking.config.TrackingProperties;
import com.logimatrix.tracking.dto.IngestionResult;
import com.logimatrix.tracking.dto.IngestionStatus;
import com.logimatrix.tracking.dto.TelemetryAlarmEvent;
import com.logimatrix.tracking.dto.TelemetryRecord;
import com.logimatrix.tracking.dto.TelemetryResult;
import com.logimatrix.tracking.dto.TelemetryUpdateEvent;
import com.logimatrix.tracking.entity.VehicleTelemetry;
import com.logimatrix.tracking.exception.FixValidationException;
import com.logimatrix.tracking.exception.NoTelemetryException;
import com.logimatrix.tracking.repository.VehicleTelemetryRepository;
import com.logimatrix.tracking.support.MutableClock;
import com.logimatrix.tracking.support.RecordingTransport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Pageable;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TelemetryIngestionServiceTest {

    private static final Instant TS = Instant.parse("2024-01-01T12:00:00Z");

    private TrackingProperties properties;
    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private InMemorySubscriptionBus bus;
    private VehicleTelemetryRepository repository;
    private Set<String> knownVehicles;
    private TelemetryIngestionService service;

    @BeforeEach
    void setUp() {
        properties = new TrackingProperties();
        clock = new MutableClock(TS);
        meterRegistry = new SimpleMeterRegistry();
        bus = new InMemorySubscriptionBus(Runnable::run, properties, meterRegistry);
        repository = mock(VehicleTelemetryRepository.class);
        knownVehicles = ConcurrentHashMap.newKeySet();
        knownVehicles.add("V");
        service = new TelemetryIngestionService(new TelemetryEvaluator(properties), bus,
            (tenantId, vehicleId) -> knownVehicles.contains(vehicleId), repository,
            new BoundedIo(Runnable::run), properties, meterRegistry, clock);
    }

    @Test
    void alarmsArePublishedOnceToTenantAndVehicleRooms() {
        RecordingTransport dashboard = new RecordingTransport("dashboard");
        bus.register(dashboard);
        bus.join("dashboard", "tenant:acme");
        bus.join("dashboard", "vehicle:V");

        TelemetryResult result = service.ingest(
            new TelemetryRecord("acme", "V", TS, null, 95.0, 10.0, 11.2, null, null, null, null));

        assertThat(result.status()).isEqualTo(IngestionStatus.ACCEPTED);
        assertThat(result.alarms()).hasSize(2);
        assertThat(dashboard.types()).containsExactly(
            TelemetryUpdateEvent.TYPE, TelemetryAlarmEvent.TYPE, TelemetryAlarmEvent.TYPE);
    }

    @Test
    void everySampleIsStoredAndSentToTheVehicleRoomOnly() {
        RecordingTransport driverApp = new RecordingTransport("driver-app");
        RecordingTransport dispatcher = new RecordingTransport("dispatcher");
        bus.register(driverApp);
        bus.register(dispatcher);
        bus.join("driver-app", "vehicle:V");
        bus.join("dispatcher", "tenant:acme");

        TelemetryResult result = service.ingest(
            new TelemetryRecord("acme", "V", TS, 1800.0, 80.0, 60.0, 12.6, null, null, 48211.0, Set.of("P0300")));

        assertThat(result.alarms()).isEmpty();
        assertThat(driverApp.types()).containsExactly(TelemetryUpdateEvent.TYPE);
        assertThat(dispatcher.received()).isEmpty();

        TelemetryUpdateEvent update = (TelemetryUpdateEvent) driverApp.received().get(0);
        assertThat(update.fuelPct()).isEqualTo(60.0);
        assertThat(update.diagnosticCodes()).containsExactly("P0300");
        assertThat(update.serverTs()).isEqualTo(TS);

        ArgumentCaptor<VehicleTelemetry> saved = ArgumentCaptor.forClass(VehicleTelemetry.class);
        verify(repository).save(saved.capture());
        assertThat(saved.getValue().getOdometer()).isEqualTo(48211.0);
        assertThat(saved.getValue().getDiagnosticCodes()).containsExactly("P0300");
    }

    @Test
    void resentSampleIsNotStoredTwice() {
        when(repository.existsByVehicleIdAndTs("V", TS)).thenReturn(true);

        TelemetryResult result = service.ingest(sample(TS));

        assertThat(result.status()).isEqualTo(IngestionStatus.ACCEPTED);
        verify(repository, never()).save(any(VehicleTelemetry.class));
    }

    @Test
    void unknownVehicleIsRejectedWithoutSideEffects() {
        RecordingTransport dashboard = new RecordingTransport("dashboard");
        bus.register(dashboard);
        bus.join("dashboard", "tenant:acme");
        bus.join("dashboard", "vehicle:STRANGER");

        TelemetryResult result = service.ingest(
            new TelemetryRecord("acme", "STRANGER", TS, null, null, 5.0, null, null, null, null, null));

        assertThat(result.status()).isEqualTo(IngestionStatus.REJECTED);
        assertThat(result.reason()).isEqualTo(IngestionResult.UNKNOWN_VEHICLE);
        assertThat(result.alarms()).isEmpty();
        assertThat(dashboard.received()).isEmpty();
        verify(repository, never()).save(any(VehicleTelemetry.class));
        assertThat(meterRegistry.counter("tracking.telemetry.rejected", "reason", IngestionResult.UNKNOWN_VEHICLE).count())
            .isEqualTo(1.0);
    }

    @Test
    void storeFailureStillEvaluatesAndPublishes() {
        when(repository.save(any(VehicleTelemetry.class))).thenThrow(new DataAccessResourceFailureException("db down"));
        RecordingTransport dashboard = new RecordingTransport("dashboard");
        bus.register(dashboard);
        bus.join("dashboard", "vehicle:V");

        TelemetryResult result = service.ingest(
            new TelemetryRecord("acme", "V", TS, null, null, 10.0, null, null, null, null, null));

        assertThat(result.status()).isEqualTo(IngestionStatus.ACCEPTED);
        assertThat(dashboard.types()).containsExactly(TelemetryUpdateEvent.TYPE, TelemetryAlarmEvent.TYPE);
        assertThat(meterRegistry.counter("tracking.telemetry.store.failed").count()).isEqualTo(1.0);
    }

    @Test
    void sampleWithoutVehicleIsRejected() {
        TelemetryRecord anonymous = new TelemetryRecord("acme", " ", TS, null, null, null, null, null, null, null, null);

        assertThatThrownBy(() -> service.ingest(anonymous))
            .isInstanceOf(FixValidationException.class)
            .satisfies(e -> assertThat(((FixValidationException) e).getErrorCode()).isEqualTo(IngestionResult.MISSING_VEHICLE));
    }

    @Test
    void historyIsClampedToRetentionAndLimit() {
        clock.advance(Duration.ofDays(30));

        service.history("V", TS, null, 5000);

        ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
        verify(repository).findByVehicleIdAndTsBetweenOrderByTsDesc(
            eq("V"), eq(TS.plus(Duration.ofDays(23))), eq(TS.plus(Duration.ofDays(30))), page.capture());
        assertThat(page.getValue().getPageSize()).isEqualTo(1000);
    }

    @Test
    void latestSampleOrNoTelemetry() {
        when(repository.findFirstByVehicleIdOrderByTsDesc("V"))
            .thenReturn(Optional.of(VehicleTelemetry.fromRecord(sample(TS))));

        assertThat(service.latest("V").fuelPct()).isEqualTo(60.0);
        assertThatThrownBy(() -> service.latest("W"))
            .isInstanceOf(NoTelemetryException.class)
            .hasMessageContaining("W");
    }

    private static TelemetryRecord sample(Instant ts) {
        return new TelemetryRecord("acme", "V", ts, null, 80.0, 60.0, 12.6, null, null, null, null);
    }
}
