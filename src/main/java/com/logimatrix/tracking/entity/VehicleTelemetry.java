package com.logimatrix.tracking.entity;

import com.logimatrix.tracking.dto.TelemetryRecord;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * One telemetry sample of a vehicle. A resent sample with the same
 * (vehicle_id, ts) is stored once.
 */
@Entity
@Table(
    name = "vehicle_telemetry",
    uniqueConstraints = @UniqueConstraint(name = "uk_vehicle_telemetry_vehicle_ts", columnNames = {"vehicle_id", "ts"}),
    indexes = {
        @Index(name = "idx_vehicle_telemetry_vehicle_ts", columnList = "vehicle_id, ts"),
        @Index(name = "idx_vehicle_telemetry_ts", columnList = "ts")
    }
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VehicleTelemetry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 100)
    private String tenantId;

    @Column(name = "vehicle_id", nullable = false, length = 100)
    private String vehicleId;

    @Column(nullable = false)
    private Instant ts;

    @Column(name = "engine_rpm")
    private Double engineRpm;

    @Column(name = "engine_temperature_c")
    private Double engineTemperatureC;

    @Column(name = "fuel_pct")
    private Double fuelPct;

    @Column(name = "battery_v")
    private Double batteryV;

    @Column(name = "tire_pressure")
    private Double tirePressure;

    @Column(name = "oil_pressure")
    private Double oilPressure;

    private Double odometer;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "vehicle_telemetry_dtc", joinColumns = @JoinColumn(name = "telemetry_id"))
    @Column(name = "code", length = 20)
    @Builder.Default
    private Set<String> diagnosticCodes = new HashSet<>();

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static VehicleTelemetry fromRecord(TelemetryRecord telemetry) {
        return VehicleTelemetry.builder()
            .tenantId(telemetry.tenantId())
            .vehicleId(telemetry.vehicleId())
            .ts(telemetry.ts())
            .engineRpm(telemetry.engineRpm())
            .engineTemperatureC(telemetry.engineTemperatureC())
            .fuelPct(telemetry.fuelPct())
            .batteryV(telemetry.batteryV())
            .tirePressure(telemetry.tirePressure())
            .oilPressure(telemetry.oilPressure())
            .odometer(telemetry.odometer())
            .diagnosticCodes(new HashSet<>(telemetry.diagnosticCodes()))
            .build();
    }

    public TelemetryRecord toRecord() {
        return new TelemetryRecord(tenantId, vehicleId, ts, engineRpm, engineTemperatureC, fuelPct,
            batteryV, tirePressure, oilPressure, odometer, diagnosticCodes);
    }
}
