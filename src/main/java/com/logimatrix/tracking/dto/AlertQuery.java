package com.logimatrix.tracking.dto;

import com.logimatrix.tracking.entity.AccidentSeverity;
import com.logimatrix.tracking.entity.AlertStatus;
import com.logimatrix.tracking.entity.AlertType;

import java.time.Instant;

/**
 * Filters of an alert-log query. Every field is optional.
 */
public record AlertQuery(
    String tenantId,
    String vehicleId,
    String driverId,
    AccidentSeverity severity,
    AlertType alertType,
    AlertStatus status,
    Instant from,
    Instant to
) {

    public static AlertQuery forVehicle(String vehicleId) {
        return new AlertQuery(null, vehicleId, null, null, null, null, null, null);
    }
}
