package com.logimatrix.tracking.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Immutable DTO representing one GPS fix from a vehicle.
 *
 * Fields are nullable on purpose: the ingestion coordinator validates them and
 * answers with a rejection reason instead of a deserialization error, so a
 * producer always gets an ingestion outcome.
 *
 * @param tenantId   owning tenant (company)
 * @param vehicleId  reporting vehicle
 * @param shipmentId optional shipment the vehicle is carrying
 * @param driverId   optional driver at the wheel
 * @param lat        latitude in decimal degrees (WGS84)
 * @param lon        longitude in decimal degrees (WGS84)
 * @param speed      optional speed in km/h
 * @param heading    optional direction in degrees (0-360, 0 is North)
 * @param accuracy   optional horizontal accuracy in meters
 * @param altitude   optional altitude in meters
 * @param ts         when the fix was captured
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FixRecord(
    String tenantId,
    String vehicleId,
    String shipmentId,
    String driverId,
    Double lat,
    Double lon,
    Double speed,
    Double heading,
    Double accuracy,
    Double altitude,
    Instant ts
) {

    public FixRecord {
        tenantId = blankToNull(tenantId);
        vehicleId = blankToNull(vehicleId);
        shipmentId = blankToNull(shipmentId);
        driverId = blankToNull(driverId);
    }

    public static FixRecord of(String tenantId, String vehicleId, double lat, double lon, Instant ts) {
        return new FixRecord(tenantId, vehicleId, null, null, lat, lon, null, null, null, null, ts);
    }

    public FixRecord withShipment(String shipmentId) {
        return new FixRecord(tenantId, vehicleId, shipmentId, driverId, lat, lon, speed, heading, accuracy, altitude, ts);
    }

    public FixRecord withSpeed(Double speed) {
        return new FixRecord(tenantId, vehicleId, shipmentId, driverId, lat, lon, speed, heading, accuracy, altitude, ts);
    }

    public FixRecord withAccuracy(Double accuracy) {
        return new FixRecord(tenantId, vehicleId, shipmentId, driverId, lat, lon, speed, heading, accuracy, altitude, ts);
    }

    @JsonIgnore
    public boolean hasShipment() {
        return shipmentId != null;
    }

    /**
     * Checks if the reported accuracy is good enough to change zone membership.
     * A fix without an accuracy is trusted.
     */
    public boolean hasAcceptableAccuracy(double ceilingMeters) {
        return accuracy == null || accuracy <= ceilingMeters;
    }

    public String toLogString() {
        return String.format(
            "Fix[tenant=%s, vehicle=%s, lat=%.6f, lon=%.6f, ts=%s]",
            tenantId, vehicleId, lat, lon, ts
        );
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
