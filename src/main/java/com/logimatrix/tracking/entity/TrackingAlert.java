package com.logimatrix.tracking.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Durable record of an emitted geofence or accident-proximity alert.
 *
 * The published payload is immutable; only the lifecycle columns (status,
 * acknowledgement, resolution) change afterwards.
 *
 * Idempotency:
 * {@code idempotency_key} is {@code vehicleId:zoneId:transitionTsMillis[:kind]}, so
 * retrying a failed write never creates a second row for the same transition.
 *
 * Denormalized zone and vehicle fields keep analytics queries free of JOINs.
 */
@Entity
@Table(
    name = "tracking_alerts",
    uniqueConstraints = @UniqueConstraint(name = "uk_tracking_alert_idempotency", columnNames = "idempotency_key"),
    indexes = {
        @Index(name = "idx_alert_vehicle_emitted", columnList = "vehicle_id, emitted_at"),
        @Index(name = "idx_alert_driver_emitted", columnList = "driver_id, emitted_at"),
        @Index(name = "idx_alert_severity", columnList = "severity"),
        @Index(name = "idx_alert_status", columnList = "status"),
        @Index(name = "idx_alert_vehicle_zone_status", columnList = "vehicle_id, zone_id, status"),
        @Index(name = "idx_alert_emitted", columnList = "emitted_at")
    }
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TrackingAlert {

    @Id
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "alert_type", nullable = false, length = 30)
    private AlertType alertType;

    @Column(name = "tenant_id", nullable = false, length = 100)
    private String tenantId;

    @Column(name = "vehicle_id", nullable = false, length = 100)
    private String vehicleId;

    @Column(name = "shipment_id", length = 100)
    private String shipmentId;

    @Column(name = "driver_id", length = 100)
    private String driverId;

    /**
     * Geofence id or accident zone id
     */
    @Column(name = "zone_id", nullable = false, length = 64)
    private String zoneId;

    @Column(name = "zone_name")
    private String zoneName;

    /**
     * Geofence edge kind (entry / exit), null for proximity alerts
     */
    @Column(length = 20)
    private String kind;

    /**
     * Accident zone severity, null for geofence alerts
     */
    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private AccidentSeverity severity;

    @Column(name = "accident_count")
    private Integer accidentCount;

    @Column(name = "distance_m")
    private Double distanceM;

    @Column(name = "zone_lat")
    private Double zoneLat;

    @Column(name = "zone_lon")
    private Double zoneLon;

    @Column(name = "vehicle_lat", nullable = false)
    private Double vehicleLat;

    @Column(name = "vehicle_lon", nullable = false)
    private Double vehicleLon;

    /**
     * Timestamp of the fix that triggered the alert
     */
    @Column(nullable = false)
    private Instant ts;

    /**
     * Server time at which the alert was emitted
     */
    @Column(name = "emitted_at", nullable = false)
    private Instant emittedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private AlertStatus status = AlertStatus.ACTIVE;

    @Column(name = "acknowledged_at")
    private Instant acknowledgedAt;

    @Column(name = "acknowledged_by", length = 100)
    private String acknowledgedBy;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "idempotency_key", nullable = false, length = 300)
    private String idempotencyKey;

    /**
     * Free-form metadata. Well-known keys: "message" (driver message for
     * proximity alerts) and "zoneName". Unknown keys pass through unchanged.
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "tracking_alert_metadata", joinColumns = @JoinColumn(name = "alert_id"))
    @MapKeyColumn(name = "meta_key", length = 100)
    @Column(name = "meta_value", length = 1000)
    @Builder.Default
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Map<String, String> metadata = new HashMap<>();

    public boolean isActive() {
        return status == AlertStatus.ACTIVE;
    }

    public String toLogString() {
        return String.format("Alert[%s, type=%s, vehicle=%s, zone=%s, status=%s]",
            id, alertType, vehicleId, zoneId, status);
    }
}
