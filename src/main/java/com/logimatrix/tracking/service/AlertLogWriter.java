package com.logimatrix.tracking.service;

import com.logimatrix.tracking.entity.AlertStatus;
import com.logimatrix.tracking.entity.AlertType;
import com.logimatrix.tracking.entity.TrackingAlert;
import com.logimatrix.tracking.exception.AlertNotFoundException;
import com.logimatrix.tracking.repository.TrackingAlertRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Transactional writes of the alert log. Kept apart from {@link AlertLogService}
 * so the transaction boundaries apply through the Spring proxy.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AlertLogWriter {

    static final Set<AlertStatus> OPEN_STATUSES = EnumSet.of(AlertStatus.ACTIVE, AlertStatus.ACKNOWLEDGED);

    private final TrackingAlertRepository repository;

    /**
     * Inserts the alert unless its idempotency key is already logged.
     *
     * A new proximity alert first resolves any older open alert of the same
     * (vehicle, zone) pair, so the pair never has two open alerts.
     *
     * @return false if the alert was already logged
     */
    @Transactional
    public boolean insertIfAbsent(TrackingAlert alert) {
        if (repository.existsByIdempotencyKey(alert.getIdempotencyKey())) {
            log.debug("Alert {} already logged", alert.getIdempotencyKey());
            return false;
        }
        if (alert.getAlertType() == AlertType.ACCIDENT_PROXIMITY) {
            List<TrackingAlert> open = repository.findByVehicleIdAndZoneIdAndAlertTypeAndStatusIn(
                alert.getVehicleId(), alert.getZoneId(), AlertType.ACCIDENT_PROXIMITY, OPEN_STATUSES);
            for (TrackingAlert previous : open) {
                previous.setStatus(AlertStatus.RESOLVED);
                previous.setResolvedAt(alert.getEmittedAt());
                log.info("Superseded open proximity alert {}", previous.toLogString());
            }
            repository.saveAll(open);
        }
        if (alert.getId() == null) {
            alert.setId(UUID.randomUUID());
        }
        repository.save(alert);
        return true;
    }

    /**
     * Resolves the proximity alert logged under {@code idempotencyKey}.
     *
     * @return false if no such alert is logged yet
     */
    @Transactional
    public boolean resolveByKey(String idempotencyKey, Instant resolvedAt) {
        Optional<TrackingAlert> found = repository.findByIdempotencyKey(idempotencyKey);
        if (found.isEmpty()) {
            return false;
        }
        TrackingAlert alert = found.get();
        if (alert.getStatus() != AlertStatus.RESOLVED) {
            alert.setStatus(AlertStatus.RESOLVED);
            alert.setResolvedAt(resolvedAt);
            repository.save(alert);
        }
        return true;
    }

    @Transactional
    public TrackingAlert acknowledge(UUID alertId, String acknowledgedBy, Instant at) {
        TrackingAlert alert = repository.findById(alertId)
            .orElseThrow(() -> new AlertNotFoundException(alertId));
        if (alert.getStatus() == AlertStatus.ACTIVE) {
            alert.setStatus(AlertStatus.ACKNOWLEDGED);
            alert.setAcknowledgedAt(at);
            alert.setAcknowledgedBy(acknowledgedBy);
            repository.save(alert);
        }
        return alert;
    }

    @Transactional
    public TrackingAlert resolve(UUID alertId, Instant at) {
        TrackingAlert alert = repository.findById(alertId)
            .orElseThrow(() -> new AlertNotFoundException(alertId));
        if (alert.getStatus() != AlertStatus.RESOLVED) {
            alert.setStatus(AlertStatus.RESOLVED);
            alert.setResolvedAt(at);
            repository.save(alert);
        }
        return alert;
    }
}
