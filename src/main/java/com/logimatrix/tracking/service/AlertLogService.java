package com.logimatrix.tracking.service;

import com.logimatrix.tracking.config.TrackingProperties;
import com.logimatrix.tracking.dto.AlertQuery;
import com.logimatrix.tracking.dto.AlertStats;
import com.logimatrix.tracking.dto.AlertView;
import com.logimatrix.tracking.dto.FixRecord;
import com.logimatrix.tracking.dto.GeofenceEdge;
import com.logimatrix.tracking.dto.ProximityActivation;
import com.logimatrix.tracking.dto.ProximityResolution;
import com.logimatrix.tracking.entity.AccidentSeverity;
import com.logimatrix.tracking.entity.AlertStatus;
import com.logimatrix.tracking.entity.AlertType;
import com.logimatrix.tracking.entity.TrackingAlert;
import com.logimatrix.tracking.repository.TrackingAlertRepository;
import com.logimatrix.tracking.repository.TrackingAlertSpecifications;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.BooleanSupplier;

/**
 * Alert Log: durable record of geofence and accident-proximity alerts.
 *
 * Write path (called by the ingestion coordinator):
 * 1. Each write runs on the I/O pool under the log-write deadline
 * 2. A failed or timed-out write is queued and retried on a schedule
 * 3. Retries are safe because every alert carries an idempotency key
 *    {@code vehicleId:zoneId:transitionTsMillis[:kind]}
 *
 * A failed log write never fails the ingestion of the fix; the alert has
 * already been published by then.
 *
 * Telemetry alarms are not logged.
 */
@Service
@Slf4j
public class AlertLogService {

    static final String META_MESSAGE = "message";
    static final String META_ZONE_NAME = "zoneName";
    private static final int TOP_ZONES = 5;

    private final AlertLogWriter writer;
    private final TrackingAlertRepository repository;
    private final BoundedIo boundedIo;
    private final TrackingProperties properties;
    private final Clock clock;
    private final Counter writeFailedCounter;
    private final Counter retryExhaustedCounter;
    private final Queue<PendingWrite> pendingWrites = new ConcurrentLinkedQueue<>();

    public AlertLogService(AlertLogWriter writer,
                           TrackingAlertRepository repository,
                           BoundedIo boundedIo,
                           TrackingProperties properties,
                           Clock clock,
                           MeterRegistry meterRegistry) {
        this.writer = writer;
        this.repository = repository;
        this.boundedIo = boundedIo;
        this.properties = properties;
        this.clock = clock;
        this.writeFailedCounter = meterRegistry.counter("tracking.alertlog.write.failed");
        this.retryExhaustedCounter = meterRegistry.counter("tracking.alertlog.retry.exhausted");
    }

    // ==================== Write path ====================

    public void recordGeofenceAlert(FixRecord fix, GeofenceEdge edge, Instant emittedAt) {
        TrackingAlert alert = TrackingAlert.builder()
            .alertType(AlertType.GEOFENCE)
            .tenantId(fix.tenantId())
            .vehicleId(fix.vehicleId())
            .shipmentId(fix.shipmentId())
            .driverId(fix.driverId())
            .zoneId(edge.zoneId())
            .zoneName(edge.zoneName())
            .kind(edge.kind().wireName())
            .vehicleLat(fix.lat())
            .vehicleLon(fix.lon())
            .ts(fix.ts())
            .emittedAt(emittedAt)
            .idempotencyKey(idempotencyKey(fix.vehicleId(), edge.zoneId(), fix.ts(), edge.kind().wireName()))
            .build();
        if (edge.zoneName() != null) {
            alert.getMetadata().put(META_ZONE_NAME, edge.zoneName());
        }
        submit(new PendingWrite("insert " + alert.getIdempotencyKey(), () -> {
            writer.insertIfAbsent(alert);
            return true;
        }));
    }

    public void recordProximityAlert(FixRecord fix, ProximityActivation activation, String zoneName, Instant emittedAt) {
        TrackingAlert alert = TrackingAlert.builder()
            .alertType(AlertType.ACCIDENT_PROXIMITY)
            .tenantId(fix.tenantId())
            .vehicleId(fix.vehicleId())
            .shipmentId(fix.shipmentId())
            .driverId(fix.driverId())
            .zoneId(activation.zoneId())
            .zoneName(zoneName)
            .severity(activation.severity())
            .accidentCount(activation.accidentCount())
            .distanceM(activation.distanceM())
            .zoneLat(activation.zoneCenter().lat())
            .zoneLon(activation.zoneCenter().lon())
            .vehicleLat(fix.lat())
            .vehicleLon(fix.lon())
            .ts(fix.ts())
            .emittedAt(emittedAt)
            .idempotencyKey(idempotencyKey(fix.vehicleId(), activation.zoneId(), fix.ts(), null))
            .build();
        alert.getMetadata().put(META_MESSAGE, activation.driverMessage());
        if (zoneName != null) {
            alert.getMetadata().put(META_ZONE_NAME, zoneName);
        }
        submit(new PendingWrite("insert " + alert.getIdempotencyKey(), () -> {
            writer.insertIfAbsent(alert);
            return true;
        }));
    }

    /**
     * Marks the proximity alert of a debounce that returned to idle as resolved.
     * If the activation itself is still waiting in the retry queue, the
     * resolution is queued behind it.
     */
    public void recordResolution(String vehicleId, ProximityResolution resolution) {
        String key = idempotencyKey(vehicleId, resolution.zoneId(), resolution.activatedAt(), null);
        Instant resolvedAt = clock.instant();
        submit(new PendingWrite("resolve " + key + " (" + resolution.reason() + ")",
            () -> writer.resolveByKey(key, resolvedAt)));
    }

    /**
     * Retries queued writes. A write that keeps failing is dropped after
     * {@code tracking.alerts.max-write-attempts} attempts.
     */
    @Scheduled(fixedDelayString = "${tracking.alerts.retry-interval-ms:5000}")
    public void retryPendingWrites() {
        int batch = pendingWrites.size();
        for (int i = 0; i < batch; i++) {
            PendingWrite write = pendingWrites.poll();
            if (write == null) {
                return;
            }
            if (attempt(write)) {
                log.info("Alert log retry succeeded: {} (attempt {})", write.description(), write.attempts() + 1);
                continue;
            }
            PendingWrite next = write.nextAttempt();
            if (next.attempts() >= properties.getAlerts().getMaxWriteAttempts()) {
                retryExhaustedCounter.increment();
                log.error("Giving up on alert log write after {} attempts: {}", next.attempts(), write.description());
            } else {
                pendingWrites.add(next);
            }
        }
    }

    public int pendingWriteCount() {
        return pendingWrites.size();
    }

    private void submit(PendingWrite write) {
        if (!pendingWrites.isEmpty()) {
            // Keep write order per alert: never overtake a queued write
            pendingWrites.add(write);
            return;
        }
        if (!attempt(write)) {
            pendingWrites.add(write.nextAttempt());
        }
    }

    private boolean attempt(PendingWrite write) {
        try {
            Duration deadline = properties.getIngest().getLogWriteTimeout();
            Boolean done = boundedIo.call("alert log write", deadline, write.action()::getAsBoolean);
            return Boolean.TRUE.equals(done);
        } catch (RuntimeException e) {
            writeFailedCounter.increment();
            log.error("Alert log write failed: {}", write.description(), e);
            return false;
        }
    }

    static String idempotencyKey(String vehicleId, String zoneId, Instant transitionTs, String kind) {
        String key = vehicleId + ":" + zoneId + ":" + transitionTs.toEpochMilli();
        return kind == null ? key : key + ":" + kind;
    }

    // ==================== Read path ====================

    /**
     * Paginated log query ordered by emission time, newest first.
     */
    public Page<AlertView> query(AlertQuery query, Integer page, Integer size) {
        return repository.findAll(TrackingAlertSpecifications.matching(query), pageable(page, size))
            .map(AlertView::from);
    }

    public List<AlertView> activeAlerts(String tenantId, Integer size) {
        Pageable pageable = PageRequest.of(0, pageSize(size));
        Page<TrackingAlert> page = tenantId == null
            ? repository.findByStatusOrderByEmittedAtDesc(AlertStatus.ACTIVE, pageable)
            : repository.findByTenantIdAndStatusOrderByEmittedAtDesc(tenantId, AlertStatus.ACTIVE, pageable);
        return page.map(AlertView::from).getContent();
    }

    /**
     * Open proximity alerts of a vehicle, used to rehydrate its debounce state.
     */
    public List<TrackingAlert> openProximityAlerts(String vehicleId) {
        return repository.findByVehicleIdAndAlertTypeAndStatusIn(
            vehicleId, AlertType.ACCIDENT_PROXIMITY, AlertLogWriter.OPEN_STATUSES);
    }

    public AlertView acknowledge(UUID alertId, String acknowledgedBy) {
        TrackingAlert alert = writer.acknowledge(alertId, acknowledgedBy, clock.instant());
        log.info("Alert acknowledged by {}: {}", acknowledgedBy, alert.toLogString());
        return AlertView.from(alert);
    }

    public AlertView resolve(UUID alertId) {
        TrackingAlert alert = writer.resolve(alertId, clock.instant());
        log.info("Alert resolved: {}", alert.toLogString());
        return AlertView.from(alert);
    }

    /**
     * Total, per-severity counts and the top five zones of one vehicle over
     * the last {@code hours} hours.
     */
    public AlertStats vehicleStats(String vehicleId, int hours) {
        Instant since = clock.instant().minus(Duration.ofHours(hours));

        long total = repository.countByVehicleIdAndEmittedAtGreaterThanEqual(vehicleId, since);

        Map<String, Long> bySeverity = new LinkedHashMap<>();
        for (Object[] row : repository.countBySeverityForVehicle(vehicleId, since)) {
            AccidentSeverity severity = (AccidentSeverity) row[0];
            String key = severity == null ? "geofence" : severity.wireName();
            bySeverity.merge(key, ((Number) row[1]).longValue(), Long::sum);
        }

        List<AlertStats.ZoneCount> topZones = new ArrayList<>();
        for (Object[] row : repository.topZonesForVehicle(vehicleId, since, PageRequest.of(0, TOP_ZONES))) {
            topZones.add(new AlertStats.ZoneCount((String) row[0], (String) row[1], ((Number) row[2]).longValue()));
        }

        return new AlertStats(vehicleId, hours, total, bySeverity, topZones);
    }

    /**
     * Deletes alerts past the retention window (90 days by default), in batches.
     */
    @Scheduled(cron = "${tracking.alerts.purge-cron:0 15 3 * * *}")
    public void purgeExpired() {
        Instant cutoff = clock.instant().minus(properties.getAlerts().getRetention());
        int deleted = 0;
        try {
            List<TrackingAlert> batch;
            while (!(batch = repository.findTop500ByEmittedAtBefore(cutoff)).isEmpty()) {
                repository.deleteAll(batch);
                deleted += batch.size();
            }
        } catch (Exception e) {
            log.error("Alert log purge failed after {} deletions", deleted, e);
            return;
        }
        if (deleted > 0) {
            log.info("Purged {} alerts emitted before {}", deleted, cutoff);
        }
    }

    private Pageable pageable(Integer page, Integer size) {
        int effectivePage = page == null || page < 0 ? 0 : page;
        return PageRequest.of(effectivePage, pageSize(size), Sort.by(Sort.Direction.DESC, "emittedAt"));
    }

    private int pageSize(Integer size) {
        TrackingProperties.Alerts alerts = properties.getAlerts();
        return size == null || size <= 0 ? alerts.getDefaultPageSize() : Math.min(size, alerts.getMaxPageSize());
    }

    /**
     * @param action returns false when the write has to be retried later
     */
    private record PendingWrite(String description, BooleanSupplier action, int attempts) {

        PendingWrite(String description, BooleanSupplier action) {
            this(description, action, 0);
        }

        PendingWrite nextAttempt() {
            return new PendingWrite(description, action, attempts + 1);
        }
    }
}
