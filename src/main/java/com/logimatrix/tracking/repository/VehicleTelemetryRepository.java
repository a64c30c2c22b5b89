package com.logimatrix.tracking.repository;

import com.logimatrix.tracking.entity.VehicleTelemetry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface VehicleTelemetryRepository extends JpaRepository<VehicleTelemetry, Long> {

    boolean existsByVehicleIdAndTs(String vehicleId, Instant ts);

    /**
     * Telemetry history, most recent first.
     */
    List<VehicleTelemetry> findByVehicleIdAndTsBetweenOrderByTsDesc(
        String vehicleId,
        Instant from,
        Instant to,
        Pageable pageable
    );

    Optional<VehicleTelemetry> findFirstByVehicleIdOrderByTsDesc(String vehicleId);

    /**
     * Purge batch. Rows are deleted through the entity so their diagnostic codes go with them.
     */
    List<VehicleTelemetry> findTop500ByTsBefore(Instant cutoff);
}
