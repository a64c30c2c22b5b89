package com.logimatrix.tracking.dto;

/**
 * One alarm produced from a telemetry sample.
 *
 * @param kind   low_fuel, overheat, low_battery, dtc, tire_pressure or low_oil_pressure
 * @param level  severity of the alarm
 * @param detail human-readable detail, for dtc the sorted code list
 */
public record TelemetryAlarm(String kind, AlarmLevel level, String detail) {

    public static final String LOW_FUEL = "low_fuel";
    public static final String OVERHEAT = "overheat";
    public static final String LOW_BATTERY = "low_battery";
    public static final String DTC = "dtc";
    public static final String TIRE_PRESSURE = "tire_pressure";
    public static final String LOW_OIL_PRESSURE = "low_oil_pressure";
}
