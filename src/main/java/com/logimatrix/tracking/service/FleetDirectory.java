package com.logimatrix.tracking.service;

import java.util.List;

/**
 * Answers whether a vehicle belongs to a tenant and may report fixes.
 */
public interface FleetDirectory {

    boolean isKnownVehicle(String tenantId, String vehicleId);

    /**
     * Active vehicles of a tenant in id order. A directory that cannot list
     * its vehicles returns none.
     */
    default List<String> activeVehicleIds(String tenantId) {
        return List.of();
    }
}
