package com.logimatrix.tracking.service;

import com.logimatrix.tracking.config.RedisConfig;
import com.logimatrix.tracking.entity.FleetVehicle;
import com.logimatrix.tracking.repository.FleetVehicleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Fleet directory backed by the shared {@code fleet_vehicles} table.
 *
 * Every fix goes through this check, so answers are cached in Redis
 * (10 minutes, see {@link RedisConfig}). Only positive answers are cached so a
 * vehicle registered after a rejected fix is accepted on its next one.
 */
@Service
@ConditionalOnProperty(name = "tracking.fleet.directory", havingValue = "jpa", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class JpaFleetDirectory implements FleetDirectory {

    private final FleetVehicleRepository fleetVehicleRepository;

    @Override
    @Cacheable(value = RedisConfig.FLEET_VEHICLE_CACHE, key = "#tenantId + ':' + #vehicleId", unless = "!#result")
    public boolean isKnownVehicle(String tenantId, String vehicleId) {
        log.debug("Fleet directory lookup for vehicle {} of tenant {}", vehicleId, tenantId);
        return fleetVehicleRepository.existsByVehicleIdAndTenantIdAndActiveTrue(vehicleId, tenantId);
    }

    @Override
    public List<String> activeVehicleIds(String tenantId) {
        return fleetVehicleRepository.findByTenantIdAndActiveTrueOrderByVehicleIdAsc(tenantId).stream()
            .map(FleetVehicle::getVehicleId)
            .toList();
    }
}
