package com.logimatrix.tracking.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Set;

/**
 * A telemetry sample as seen by the vehicle room, sent whether or not it raised an alarm.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TelemetryUpdateEvent(
    String tenantId,
    String vehicleId,
    Double engineRpm,
    Double engineTemperatureC,
    Double fuelPct,
    Double batteryV,
    Double tirePressure,
    Double oilPressure,
    Double odometer,
    Set<String> diagnosticCodes,
    Instant ts,
    Instant serverTs
) implements TrackingEvent {

    public static final String TYPE = "telemetry_update";

    public static TelemetryUpdateEvent from(TelemetryRecord telemetry, Instant serverTs) {
        return new TelemetryUpdateEvent(
            telemetry.tenantId(),
            telemetry.vehicleId(),
            telemetry.engineRpm(),
            telemetry.engineTemperatureC(),
            telemetry.fuelPct(),
            telemetry.batteryV(),
            telemetry.tirePressure(),
            telemetry.oilPressure(),
            telemetry.odometer(),
            telemetry.diagnosticCodes(),
            telemetry.ts(),
            serverTs
        );
    }

    @Override
    @JsonProperty("type")
    public String type() {
        return TYPE;
    }
}
