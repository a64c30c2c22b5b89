package com.logimatrix.tracking.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LocationUpdateEvent(
    String tenantId,
    String vehicleId,
    String shipmentId,
    double lat,
    double lon,
    Double speed,
    Double heading,
    Instant ts,
    Instant serverTs
) implements TrackingEvent {

    public static final String TYPE = "location_update";

    public static LocationUpdateEvent from(FixRecord fix, Instant serverTs) {
        return new LocationUpdateEvent(
            fix.tenantId(),
            fix.vehicleId(),
            fix.shipmentId(),
            fix.lat(),
            fix.lon(),
            fix.speed(),
            fix.heading(),
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
