package com.logimatrix.tracking.service;

import com.logimatrix.tracking.bus.SubscriptionBus;
import com.logimatrix.tracking.bus.Topics;
import com.logimatrix.tracking.config.TrackingProperties;
import com.logimatrix.tracking.dto.IngestionResult;
import com.logimatrix.tracking.dto.TelemetryAlarm;
import com.logimatrix.tracking.dto.TelemetryAlarmEvent;
import com.logimatrix.tracking.dto.TelemetryRecord;
import com.logimatrix.tracking.dto.TelemetryResult;
import com.logimatrix.tracking.dto.TelemetryUpdateEvent;
import com.logimatrix.tracking.entity.VehicleTelemetry;
import com.logimatrix.tracking.exception.FixValidationException;
import com.logimatrix.tracking.exception.NoTelemetryException;
import com.logimatrix.tracking.repository.VehicleTelemetryRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Telemetry path: fleet check, storage, the {@code telemetry_update} event on the
 * vehicle room, and alarms on the tenant and vehicle rooms.
 *
 * A failed store write is logged and counted; the sample is still evaluated and
 * published. Alarms are not written to the alert log.
 */
@Service
@Slf4j
public class TelemetryIngestionService {

    private final TelemetryEvaluator telemetryEvaluator;
    private final SubscriptionBus subscriptionBus;
    private final FleetDirectory fleetDirectory;
    private final VehicleTelemetryRepository telemetryRepository;
    private final BoundedIo boundedIo;
    private final TrackingProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Counter storeFailedCounter;

    public TelemetryIngestionService(TelemetryEvaluator telemetryEvaluator,
                                     SubscriptionBus subscriptionBus,
                                     FleetDirectory fleetDirectory,
                                     VehicleTelemetryRepository telemetryRepository,
                                     BoundedIo boundedIo,
                                     TrackingProperties properties,
                                     MeterRegistry meterRegistry,
                                     Clock clock) {
        this.telemetryEvaluator = telemetryEvaluator;
        this.subscriptionBus = subscriptionBus;
        this.fleetDirectory = fleetDirectory;
        this.telemetryRepository = telemetryRepository;
        this.boundedIo = boundedIo;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.storeFailedCounter = meterRegistry.counter("tracking.telemetry.store.failed");
    }

    /**
     * @throws FixValidationException if the tenant, vehicle or timestamp is missing
     */
    public TelemetryResult ingest(TelemetryRecord telemetry) {
        if (telemetry == null || telemetry.vehicleId() == null || telemetry.vehicleId().isBlank()) {
            throw new FixValidationException(IngestionResult.MISSING_VEHICLE, "vehicleId is required");
        }
        if (telemetry.tenantId() == null || telemetry.tenantId().isBlank()) {
            throw new FixValidationException(IngestionResult.MISSING_TENANT, "tenantId is required");
        }
        if (telemetry.ts() == null) {
            throw new FixValidationException(IngestionResult.MISSING_TIMESTAMP, "ts is required");
        }

        try {
            if (!fleetDirectory.isKnownVehicle(telemetry.tenantId(), telemetry.vehicleId())) {
                return reject(telemetry, IngestionResult.UNKNOWN_VEHICLE);
            }
        } catch (RuntimeException e) {
            log.error("Fleet directory lookup failed for {}", telemetry.toLogString(), e);
            return reject(telemetry, IngestionResult.STORE_UNAVAILABLE);
        }

        try {
            boundedIo.run("telemetry write", properties.getIngest().getLogWriteTimeout(), () -> store(telemetry));
        } catch (RuntimeException e) {
            storeFailedCounter.increment();
            log.error("Telemetry write failed for {}", telemetry.toLogString(), e);
        }

        subscriptionBus.publish(List.of(Topics.vehicle(telemetry.vehicleId())),
            TelemetryUpdateEvent.from(telemetry, clock.instant()));

        List<TelemetryAlarm> alarms = telemetryEvaluator.evaluate(telemetry);
        if (!alarms.isEmpty()) {
            List<String> topics = List.of(Topics.tenant(telemetry.tenantId()), Topics.vehicle(telemetry.vehicleId()));
            for (TelemetryAlarm alarm : alarms) {
                subscriptionBus.publish(topics, TelemetryAlarmEvent.from(telemetry, alarm));
            }
            log.info("Telemetry of vehicle {} raised {} alarm(s): {}", telemetry.vehicleId(), alarms.size(),
                alarms.stream().map(TelemetryAlarm::kind).toList());
        } else {
            log.debug("Telemetry of vehicle {} at {} raised no alarm", telemetry.vehicleId(), telemetry.ts());
        }
        return TelemetryResult.accepted(telemetry, alarms);
    }

    /**
     * Telemetry history of a vehicle, most recent first.
     *
     * The range is clamped to the retention window; {@code limit} defaults to
     * 100 and is capped at 1000.
     */
    @Transactional(readOnly = true)
    public List<TelemetryRecord> history(String vehicleId, Instant from, Instant to, Integer limit) {
        TrackingProperties.Telemetry settings = properties.getTelemetry();
        Instant now = clock.instant();
        Instant oldest = now.minus(settings.getHistoryRetention());
        Instant effectiveFrom = from == null || from.isBefore(oldest) ? oldest : from;
        Instant effectiveTo = to == null ? now : to;
        int effectiveLimit = limit == null || limit <= 0
            ? settings.getDefaultHistoryLimit()
            : Math.min(limit, settings.getMaxHistoryLimit());
        return telemetryRepository.findByVehicleIdAndTsBetweenOrderByTsDesc(
                vehicleId, effectiveFrom, effectiveTo, PageRequest.of(0, effectiveLimit))
            .stream()
            .map(VehicleTelemetry::toRecord)
            .toList();
    }

    /**
     * @throws NoTelemetryException if the vehicle never sent telemetry
     */
    @Transactional(readOnly = true)
    public TelemetryRecord latest(String vehicleId) {
        return telemetryRepository.findFirstByVehicleIdOrderByTsDesc(vehicleId)
            .map(VehicleTelemetry::toRecord)
            .orElseThrow(() -> new NoTelemetryException(vehicleId));
    }

    @Scheduled(fixedDelayString = "${tracking.telemetry.purge-interval-ms:3600000}",
               initialDelayString = "${tracking.telemetry.purge-interval-ms:3600000}")
    public void purgeExpired() {
        Instant cutoff = clock.instant().minus(properties.getTelemetry().getHistoryRetention());
        int deleted = 0;
        try {
            List<VehicleTelemetry> batch;
            while (!(batch = telemetryRepository.findTop500ByTsBefore(cutoff)).isEmpty()) {
                telemetryRepository.deleteAll(batch);
                deleted += batch.size();
            }
        } catch (Exception e) {
            log.error("Telemetry purge failed after {} deletions", deleted, e);
            return;
        }
        if (deleted > 0) {
            log.info("Purged {} telemetry samples older than {}", deleted, cutoff);
        }
    }

    private void store(TelemetryRecord telemetry) {
        if (telemetryRepository.existsByVehicleIdAndTs(telemetry.vehicleId(), telemetry.ts())) {
            log.debug("Telemetry already stored: {}", telemetry.toLogString());
            return;
        }
        try {
            telemetryRepository.save(VehicleTelemetry.fromRecord(telemetry));
        } catch (DataIntegrityViolationException e) {
            log.debug("Duplicate telemetry ignored: {}", telemetry.toLogString());
        }
    }

    private TelemetryResult reject(TelemetryRecord telemetry, String reason) {
        meterRegistry.counter("tracking.telemetry.rejected", "reason", reason).increment();
        log.warn("Rejected telemetry ({}): {}", reason, telemetry.toLogString());
        return TelemetryResult.rejected(telemetry, reason);
    }
}
