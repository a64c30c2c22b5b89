package com.logimatrix.tracking.service;

import com.logimatrix.tracking.dto.ActiveVehicle;
import com.logimatrix.tracking.dto.FixRecord;
import com.logimatrix.tracking.dto.GeoBounds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Live map of a tenant's fleet: every active vehicle with its hot position.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActiveVehicleService {

    private final FleetDirectory fleetDirectory;
    private final PositionStore positionStore;

    /**
     * Without bounds every active vehicle is listed, with a null location if it
     * has not reported recently. With bounds only vehicles whose latest position
     * lies inside are listed.
     */
    public List<ActiveVehicle> activeVehicles(String tenantId, GeoBounds bounds) {
        List<ActiveVehicle> vehicles = new ArrayList<>();
        for (String vehicleId : fleetDirectory.activeVehicleIds(tenantId)) {
            FixRecord location = latestOf(tenantId, vehicleId);
            if (bounds == null) {
                vehicles.add(new ActiveVehicle(vehicleId, location));
            } else if (location != null && bounds.contains(location.lat(), location.lon())) {
                vehicles.add(new ActiveVehicle(vehicleId, location));
            }
        }
        log.debug("Listed {} active vehicles of tenant {}", vehicles.size(), tenantId);
        return vehicles;
    }

    private FixRecord latestOf(String tenantId, String vehicleId) {
        try {
            return positionStore.getLatest(vehicleId)
                .filter(fix -> tenantId.equals(fix.tenantId()))
                .orElse(null);
        } catch (RuntimeException e) {
            log.warn("Could not read the latest position of vehicle {}: {}", vehicleId, e.getMessage());
            return null;
        }
    }
}
