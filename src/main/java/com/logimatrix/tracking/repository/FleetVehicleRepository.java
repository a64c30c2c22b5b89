package com.logimatrix.tracking.repository;

import com.logimatrix.tracking.entity.FleetVehicle;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FleetVehicleRepository extends JpaRepository<FleetVehicle, String> {

    boolean existsByVehicleIdAndTenantIdAndActiveTrue(String vehicleId, String tenantId);

    List<FleetVehicle> findByTenantIdAndActiveTrueOrderByVehicleIdAsc(String tenantId);
}
