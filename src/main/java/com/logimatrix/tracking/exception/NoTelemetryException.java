package com.logimatrix.tracking.exception;

/**
 * No telemetry sample is stored for the vehicle.
 */
public class NoTelemetryException extends TrackingException {

    public NoTelemetryException(String vehicleId) {
        super("no_telemetry", "No telemetry for vehicle " + vehicleId);
    }
}
