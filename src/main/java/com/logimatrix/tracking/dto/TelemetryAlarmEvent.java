package com.logimatrix.tracking.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record TelemetryAlarmEvent(
    String tenantId,
    String vehicleId,
    String kind,
    AlarmLevel level,
    String detail,
    Instant ts
) implements TrackingEvent {

    public static final String TYPE = "vehicle_telemetry_alarm";

    public static TelemetryAlarmEvent from(TelemetryRecord telemetry, TelemetryAlarm alarm) {
        return new TelemetryAlarmEvent(
            telemetry.tenantId(),
            telemetry.vehicleId(),
            alarm.kind(),
            alarm.level(),
            alarm.detail(),
            telemetry.ts()
        );
    }

    @Override
    @JsonProperty("type")
    public String type() {
        return TYPE;
    }
}
