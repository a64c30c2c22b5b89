package com.logimatrix.tracking.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.logimatrix.tracking.entity.AccidentSeverity;
import com.logimatrix.tracking.entity.AlertStatus;
import com.logimatrix.tracking.entity.AlertType;
import com.logimatrix.tracking.entity.TrackingAlert;
import com.logimatrix.tracking.geo.GeoPoint;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Alert-log entry as returned by the API: the published alert shape plus its lifecycle.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AlertView(
    UUID id,
    AlertType alertType,
    String tenantId,
    String vehicleId,
    String shipmentId,
    String driverId,
    String zoneId,
    String zoneName,
    String kind,
    AccidentSeverity severity,
    Integer accidentCount,
    Double distanceM,
    GeoPoint zoneCenter,
    GeoPoint vehicleLocation,
    Instant ts,
    Instant emittedAt,
    AlertStatus status,
    Instant acknowledgedAt,
    String acknowledgedBy,
    Instant resolvedAt,
    Map<String, String> metadata
) {

    public static AlertView from(TrackingAlert alert) {
        GeoPoint zoneCenter = alert.getZoneLat() != null && alert.getZoneLon() != null
            ? new GeoPoint(alert.getZoneLat(), alert.getZoneLon())
            : null;
        return new AlertView(
            alert.getId(),
            alert.getAlertType(),
            alert.getTenantId(),
            alert.getVehicleId(),
            alert.getShipmentId(),
            alert.getDriverId(),
            alert.getZoneId(),
            alert.getZoneName(),
            alert.getKind(),
            alert.getSeverity(),
            alert.getAccidentCount(),
            alert.getDistanceM(),
            zoneCenter,
            new GeoPoint(alert.getVehicleLat(), alert.getVehicleLon()),
            alert.getTs(),
            alert.getEmittedAt(),
            alert.getStatus(),
            alert.getAcknowledgedAt(),
            alert.getAcknowledgedBy(),
            alert.getResolvedAt(),
            Map.copyOf(alert.getMetadata())
        );
    }
}
