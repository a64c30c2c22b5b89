package com.logimatrix.tracking.repository;

import com.logimatrix.tracking.entity.TrackPoint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Repository for the per-vehicle track history.
 *
 * All range queries are bounded by the caller to the retention window, so rows
 * that are past retention but not yet purged are never returned.
 */
@Repository
public interface TrackPointRepository extends JpaRepository<TrackPoint, Long> {

    boolean existsByVehicleIdAndTs(String vehicleId, Instant ts);

    /**
     * History query, most recent first.
     */
    List<TrackPoint> findByVehicleIdAndTsBetweenOrderByTsDesc(
        String vehicleId,
        Instant from,
        Instant to,
        Pageable pageable
    );

    /**
     * Shipment trail, oldest first.
     */
    List<TrackPoint> findByShipmentIdAndTsBetweenOrderByTsAsc(
        String shipmentId,
        Instant from,
        Instant to,
        Pageable pageable
    );

    /**
     * Recent samples feeding the ETA speed estimator, oldest first.
     */
    List<TrackPoint> findByVehicleIdAndTsAfterOrderByTsAsc(String vehicleId, Instant since);

    @Transactional
    @Modifying
    @Query("DELETE FROM TrackPoint p WHERE p.ts < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
