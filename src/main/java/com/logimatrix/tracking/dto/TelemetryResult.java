package com.logimatrix.tracking.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one telemetry ingestion: accepted with the alarms it raised, or
 * rejected with a reason when the vehicle is unknown.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TelemetryResult(IngestionStatus status, String reason, String vehicleId, Instant ts, List<TelemetryAlarm> alarms) {

    public TelemetryResult {
        alarms = alarms == null ? List.of() : List.copyOf(alarms);
    }

    public static TelemetryResult accepted(TelemetryRecord telemetry, List<TelemetryAlarm> alarms) {
        return new TelemetryResult(IngestionStatus.ACCEPTED, null, telemetry.vehicleId(), telemetry.ts(), alarms);
    }

    public static TelemetryResult rejected(TelemetryRecord telemetry, String reason) {
        return new TelemetryResult(IngestionStatus.REJECTED, reason, telemetry.vehicleId(), telemetry.ts(), List.of());
    }
}
