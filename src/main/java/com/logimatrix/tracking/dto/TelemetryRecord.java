package com.logimatrix.tracking.dto;

import java.time.Instant;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Vehicle telemetry sample. Every reading is optional; only present readings
 * are evaluated.
 */
public record TelemetryRecord(
    String tenantId,
    String vehicleId,
    Instant ts,
    Double engineRpm,
    Double engineTemperatureC,
    Double fuelPct,
    Double batteryV,
    Double tirePressure,
    Double oilPressure,
    Double odometer,
    Set<String> diagnosticCodes
) {

    public TelemetryRecord {
        TreeSet<String> codes = new TreeSet<>();
        if (diagnosticCodes != null) {
            for (String code : diagnosticCodes) {
                if (code != null && !code.isBlank()) {
                    codes.add(code.trim());
                }
            }
        }
        diagnosticCodes = Collections.unmodifiableSortedSet(codes);
    }

    public String toLogString() {
        return String.format("Telemetry[tenant=%s, vehicle=%s, ts=%s, dtc=%d]",
            tenantId, vehicleId, ts, diagnosticCodes.size());
    }
}
