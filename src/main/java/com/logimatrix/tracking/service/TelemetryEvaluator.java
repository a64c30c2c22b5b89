package com.logimatrix.tracking.service;

import com.logimatrix.tracking.config.TrackingProperties;
import com.logimatrix.tracking.dto.AlarmLevel;
import com.logimatrix.tracking.dto.TelemetryAlarm;
import com.logimatrix.tracking.dto.TelemetryRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Stateless threshold evaluator over telemetry samples.
 *
 * Default rules:
 * - fuelPct < 15            -> low_fuel (warning)
 * - engineTemperatureC > 100 -> overheat (warning)
 * - batteryV < 11.5          -> low_battery (warning)
 * - any diagnostic code      -> dtc (info), codes listed in the detail
 *
 * Tire-pressure and oil-pressure rules only run when their bounds are configured.
 */
@Component
@RequiredArgsConstructor
public class TelemetryEvaluator {

    private final TrackingProperties properties;

    public List<TelemetryAlarm> evaluate(TelemetryRecord telemetry) {
        TrackingProperties.Telemetry rules = properties.getTelemetry();
        List<TelemetryAlarm> alarms = new ArrayList<>();

        if (telemetry.fuelPct() != null && telemetry.fuelPct() < rules.getLowFuelPct()) {
            alarms.add(new TelemetryAlarm(TelemetryAlarm.LOW_FUEL, AlarmLevel.WARNING,
                format("Fuel at %.1f%% (threshold %.1f%%)", telemetry.fuelPct(), rules.getLowFuelPct())));
        }
        if (telemetry.engineTemperatureC() != null && telemetry.engineTemperatureC() > rules.getOverheatC()) {
            alarms.add(new TelemetryAlarm(TelemetryAlarm.OVERHEAT, AlarmLevel.WARNING,
                format("Engine at %.1f°C (threshold %.1f°C)", telemetry.engineTemperatureC(), rules.getOverheatC())));
        }
        if (telemetry.batteryV() != null && telemetry.batteryV() < rules.getLowBatteryV()) {
            alarms.add(new TelemetryAlarm(TelemetryAlarm.LOW_BATTERY, AlarmLevel.WARNING,
                format("Battery at %.2fV (threshold %.2fV)", telemetry.batteryV(), rules.getLowBatteryV())));
        }
        if (telemetry.tirePressure() != null) {
            Double min = rules.getTirePressureMin();
            Double max = rules.getTirePressureMax();
            if (min != null && telemetry.tirePressure() < min) {
                alarms.add(new TelemetryAlarm(TelemetryAlarm.TIRE_PRESSURE, AlarmLevel.WARNING,
                    format("Tire pressure %.1f below %.1f", telemetry.tirePressure(), min)));
            } else if (max != null && telemetry.tirePressure() > max) {
                alarms.add(new TelemetryAlarm(TelemetryAlarm.TIRE_PRESSURE, AlarmLevel.WARNING,
                    format("Tire pressure %.1f above %.1f", telemetry.tirePressure(), max)));
            }
        }
        if (telemetry.oilPressure() != null && rules.getOilPressureMin() != null
            && telemetry.oilPressure() < rules.getOilPressureMin()) {
            alarms.add(new TelemetryAlarm(TelemetryAlarm.LOW_OIL_PRESSURE, AlarmLevel.WARNING,
                format("Oil pressure %.1f below %.1f", telemetry.oilPressure(), rules.getOilPressureMin())));
        }
        if (!telemetry.diagnosticCodes().isEmpty()) {
            alarms.add(new TelemetryAlarm(TelemetryAlarm.DTC, AlarmLevel.INFO,
                String.join(",", telemetry.diagnosticCodes())));
        }
        return alarms;
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
