package com.logimatrix.tracking.repository;

import com.logimatrix.tracking.entity.AlertStatus;
import com.logimatrix.tracking.entity.AlertType;
import com.logimatrix.tracking.entity.TrackingAlert;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for the alert log.
 *
 * Filtered, paginated queries go through {@link JpaSpecificationExecutor} with
 * {@link TrackingAlertSpecifications}; the statistics below back the per-vehicle
 * dashboard.
 */
@Repository
public interface TrackingAlertRepository extends JpaRepository<TrackingAlert, UUID>,
    JpaSpecificationExecutor<TrackingAlert> {

    Optional<TrackingAlert> findByIdempotencyKey(String idempotencyKey);

    boolean existsByIdempotencyKey(String idempotencyKey);

    /**
     * Alerts of one (vehicle, zone) pair in the given statuses.
     * Use case: closing an older open proximity alert before a new one is logged.
     */
    List<TrackingAlert> findByVehicleIdAndZoneIdAndAlertTypeAndStatusIn(
        String vehicleId,
        String zoneId,
        AlertType alertType,
        Collection<AlertStatus> statuses
    );

    /**
     * Use case: rehydrating the proximity debounce of a vehicle after a restart.
     */
    List<TrackingAlert> findByVehicleIdAndAlertTypeAndStatusIn(
        String vehicleId,
        AlertType alertType,
        Collection<AlertStatus> statuses
    );

    Page<TrackingAlert> findByStatusOrderByEmittedAtDesc(AlertStatus status, Pageable pageable);

    Page<TrackingAlert> findByTenantIdAndStatusOrderByEmittedAtDesc(String tenantId, AlertStatus status, Pageable pageable);

    long countByVehicleIdAndEmittedAtGreaterThanEqual(String vehicleId, Instant since);

    /**
     * Alert counts per accident severity for one vehicle.
     * Returns: severity, count (geofence alerts are counted under a null severity)
     */
    @Query("""
        SELECT a.severity, COUNT(a)
        FROM TrackingAlert a
        WHERE a.vehicleId = :vehicleId
        AND a.emittedAt >= :since
        GROUP BY a.severity
        """)
    List<Object[]> countBySeverityForVehicle(
        @Param("vehicleId") String vehicleId,
        @Param("since") Instant since
    );

    /**
     * Zones that alerted most often for one vehicle.
     * Returns: zone_id, zone_name, alert_count
     */
    @Query("""
        SELECT a.zoneId, a.zoneName, COUNT(a)
        FROM TrackingAlert a
        WHERE a.vehicleId = :vehicleId
        AND a.emittedAt >= :since
        GROUP BY a.zoneId, a.zoneName
        ORDER BY COUNT(a) DESC
        """)
    List<Object[]> topZonesForVehicle(
        @Param("vehicleId") String vehicleId,
        @Param("since") Instant since,
        Pageable pageable
    );

    /**
     * Retention purge batch. Rows are deleted through the entity so their
     * metadata rows go with them.
     */
    List<TrackingAlert> findTop500ByEmittedAtBefore(Instant cutoff);
}
