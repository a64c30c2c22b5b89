package com.logimatrix.tracking.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.logimatrix.tracking.entity.AccidentSeverity;
import com.logimatrix.tracking.geo.GeoPoint;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AccidentProximityAlertEvent(
    String tenantId,
    String vehicleId,
    String shipmentId,
    String accidentZoneId,
    AccidentSeverity severity,
    int accidentCount,
    double distanceM,
    GeoPoint zoneCenter,
    GeoPoint vehicleLocation,
    String message,
    Instant ts,
    Instant serverTs
) implements TrackingEvent {

    public static final String TYPE = "accident_proximity_alert";

    public static AccidentProximityAlertEvent from(FixRecord fix, ProximityActivation activation, Instant serverTs) {
        return new AccidentProximityAlertEvent(
            fix.tenantId(),
            fix.vehicleId(),
            fix.shipmentId(),
            activation.zoneId(),
            activation.severity(),
            activation.accidentCount(),
            activation.distanceM(),
            activation.zoneCenter(),
            new GeoPoint(fix.lat(), fix.lon()),
            activation.driverMessage(),
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
