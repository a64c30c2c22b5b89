package com.logimatrix.tracking.dto;

import com.logimatrix.tracking.entity.Geofence;
import com.logimatrix.tracking.geo.ZoneShape;

import java.util.Set;

/**
 * In-memory geofence held by the zone registry.
 *
 * Built once from the entity so the per-fix path never touches JPA or parses
 * WKT. Immutable and safe to share across snapshots.
 *
 * @param vehicleIds  vehicles the zone applies to; empty with empty shipmentIds means tenant-wide
 * @param shipmentIds shipments the zone applies to
 */
public record CachedGeofence(
    String zoneId,
    String tenantId,
    String name,
    ZoneShape shape,
    Set<String> vehicleIds,
    Set<String> shipmentIds,
    boolean onEntry,
    boolean onExit
) {

    public CachedGeofence {
        vehicleIds = vehicleIds == null ? Set.of() : Set.copyOf(vehicleIds);
        shipmentIds = shipmentIds == null ? Set.of() : Set.copyOf(shipmentIds);
    }

    public static CachedGeofence fromEntity(Geofence geofence) {
        return new CachedGeofence(
            geofence.getId(),
            geofence.getTenantId(),
            geofence.getName(),
            geofence.toShape(),
            geofence.getVehicleIds(),
            geofence.getShipmentIds(),
            !Boolean.FALSE.equals(geofence.getOnEntry()),
            !Boolean.FALSE.equals(geofence.getOnExit())
        );
    }

    /**
     * Scope filter: tenant-wide zones apply to every vehicle, scoped zones to
     * the listed vehicles and shipments.
     */
    public boolean appliesTo(FixRecord fix) {
        if (vehicleIds.isEmpty() && shipmentIds.isEmpty()) {
            return true;
        }
        return vehicleIds.contains(fix.vehicleId())
            || (fix.shipmentId() != null && shipmentIds.contains(fix.shipmentId()));
    }

    public String toLogString() {
        return String.format("Geofence[id=%s, tenant=%s, name=%s, shape=%s]", zoneId, tenantId, name, shape);
    }
}
