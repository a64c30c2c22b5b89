package com.logimatrix.tracking.service;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;

/**
 * Accepts every non-blank tenant and vehicle. For deployments without a fleet table.
 *
 * Without a table to list, a tenant's active vehicles are the ones that
 * reported to this instance since it started.
 */
@Service
@ConditionalOnProperty(name = "tracking.fleet.directory", havingValue = "permissive")
public class PermissiveFleetDirectory implements FleetDirectory {

    private final Map<String, Set<String>> reportedVehicles = new ConcurrentHashMap<>();

    @Override
    public boolean isKnownVehicle(String tenantId, String vehicleId) {
        boolean known = tenantId != null && !tenantId.isBlank() && vehicleId != null && !vehicleId.isBlank();
        if (known) {
            reportedVehicles.computeIfAbsent(tenantId, id -> new ConcurrentSkipListSet<>()).add(vehicleId);
        }
        return known;
    }

    @Override
    public List<String> activeVehicleIds(String tenantId) {
        return List.copyOf(reportedVehicles.getOrDefault(tenantId, Set.of()));
    }
}
