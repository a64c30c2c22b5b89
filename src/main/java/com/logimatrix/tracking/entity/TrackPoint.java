package com.logimatrix.tracking.entity;

import com.logimatrix.tracking.dto.FixRecord;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

/**
 * One accepted fix in the durable track history.
 *
 * The unique (vehicle_id, ts) constraint makes a resent fix a no-op even if it
 * slips past the hot-cache staleness check after a restart.
 */
@Entity
@Table(
    name = "track_points",
    uniqueConstraints = @UniqueConstraint(name = "uk_track_point_vehicle_ts", columnNames = {"vehicle_id", "ts"}),
    indexes = {
        @Index(name = "idx_track_point_vehicle_ts", columnList = "vehicle_id, ts"),
        @Index(name = "idx_track_point_shipment_ts", columnList = "shipment_id, ts"),
        @Index(name = "idx_track_point_ts", columnList = "ts")
    }
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TrackPoint {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 100)
    private String tenantId;

    @Column(name = "vehicle_id", nullable = false, length = 100)
    private String vehicleId;

    @Column(name = "shipment_id", length = 100)
    private String shipmentId;

    @Column(name = "driver_id", length = 100)
    private String driverId;

    @Column(nullable = false)
    private Double latitude;

    @Column(nullable = false)
    private Double longitude;

    private Double speed;

    private Double heading;

    private Double accuracy;

    private Double altitude;

    @Column(nullable = false)
    private Instant ts;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static TrackPoint fromFix(FixRecord fix) {
        return TrackPoint.builder()
            .tenantId(fix.tenantId())
            .vehicleId(fix.vehicleId())
            .shipmentId(fix.shipmentId())
            .driverId(fix.driverId())
            .latitude(fix.lat())
            .longitude(fix.lon())
            .speed(fix.speed())
            .heading(fix.heading())
            .accuracy(fix.accuracy())
            .altitude(fix.altitude())
            .ts(fix.ts())
            .build();
    }

    public FixRecord toFix() {
        return new FixRecord(tenantId, vehicleId, shipmentId, driverId,
            latitude, longitude, speed, heading, accuracy, altitude, ts);
    }
}
