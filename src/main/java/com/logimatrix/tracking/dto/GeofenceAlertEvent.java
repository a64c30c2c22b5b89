package com.logimatrix.tracking.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record GeofenceAlertEvent(
    String tenantId,
    String vehicleId,
    String shipmentId,
    String zoneId,
    String zoneName,
    GeofenceEdgeKind kind,
    Instant ts,
    Instant serverTs
) implements TrackingEvent {

    public static final String TYPE = "geofence_alert";

    public static GeofenceAlertEvent from(FixRecord fix, GeofenceEdge edge, Instant serverTs) {
        return new GeofenceAlertEvent(
            fix.tenantId(),
            fix.vehicleId(),
            fix.shipmentId(),
            edge.zoneId(),
            edge.zoneName(),
            edge.kind(),
            fix.ts(),
            serverTs
        );
    }

    @Override
    @JsonProperty("type")
    public String type() {
        return TYPE;
    }
}
