package com.logimatrix.tracking.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one fix ingestion, returned to the producer.
 *
 * @param status          accepted, stale_ignored or rejected
 * @param reason          machine-readable rejection reason, null unless rejected
 * @param vehicleId       vehicle of the fix, if it had one
 * @param ts              timestamp of the fix, if it had one
 * @param geofenceAlerts  geofence edges emitted by this fix
 * @param proximityAlerts accident-proximity activations emitted by this fix
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IngestionResult(
    IngestionStatus status,
    String reason,
    String vehicleId,
    Instant ts,
    List<GeofenceEdge> geofenceAlerts,
    List<ProximityActivation> proximityAlerts
) {

    public static final String MISSING_TENANT = "missing_tenant";
    public static final String MISSING_VEHICLE = "missing_vehicle";
    public static final String MISSING_COORDINATES = "missing_coordinates";
    public static final String LATITUDE_OUT_OF_RANGE = "latitude_out_of_range";
    public static final String LONGITUDE_OUT_OF_RANGE = "longitude_out_of_range";
    public static final String MISSING_TIMESTAMP = "missing_timestamp";
    public static final String TIMESTAMP_IN_FUTURE = "timestamp_in_future";
    public static final String TIMESTAMP_TOO_OLD = "timestamp_too_old";
    public static final String INVALID_SPEED = "invalid_speed";
    public static final String INVALID_HEADING = "invalid_heading";
    public static final String INVALID_ACCURACY = "invalid_accuracy";
    public static final String UNKNOWN_VEHICLE = "unknown_vehicle";
    public static final String STORE_UNAVAILABLE = "store_unavailable";
    public static final String DROPPED_BY_BACKPRESSURE = "dropped_by_backpressure";
    public static final String RESPONSE_TIMEOUT = "response_timeout";
    public static final String INTERNAL_ERROR = "internal_error";

    public IngestionResult {
        geofenceAlerts = geofenceAlerts == null ? List.of() : List.copyOf(geofenceAlerts);
        proximityAlerts = proximityAlerts == null ? List.of() : List.copyOf(proximityAlerts);
    }

    public static IngestionResult accepted(FixRecord fix, List<GeofenceEdge> edges, List<ProximityActivation> activations) {
        return new IngestionResult(IngestionStatus.ACCEPTED, null, fix.vehicleId(), fix.ts(), edges, activations);
    }

    public static IngestionResult stale(FixRecord fix) {
        return new IngestionResult(IngestionStatus.STALE_IGNORED, null, fix.vehicleId(), fix.ts(), null, null);
    }

    public static IngestionResult rejected(FixRecord fix, String reason) {
        return new IngestionResult(IngestionStatus.REJECTED, reason,
            fix != null ? fix.vehicleId() : null, fix != null ? fix.ts() : null, null, null);
    }

    @JsonIgnore
    public boolean isAccepted() {
        return status == IngestionStatus.ACCEPTED;
    }

    @JsonIgnore
    public boolean isRejected() {
        return status == IngestionStatus.REJECTED;
    }
}
