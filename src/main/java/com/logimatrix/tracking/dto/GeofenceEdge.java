package com.logimatrix.tracking.dto;

/**
 * A membership transition of one vehicle across one geofence boundary.
 */
public record GeofenceEdge(String zoneId, String zoneName, GeofenceEdgeKind kind) {

    public String toLogString() {
        return kind.wireName() + "@" + zoneId;
    }
}
