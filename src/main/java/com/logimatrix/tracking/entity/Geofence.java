package com.logimatrix.tracking.entity;

import com.logimatrix.tracking.geo.CircleShape;
import com.logimatrix.tracking.geo.GeoPoint;
import com.logimatrix.tracking.geo.PolygonShape;
import com.logimatrix.tracking.geo.ZoneShape;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * Tenant-defined geofence.
 *
 * Design Decision - WKT instead of a spatial column:
 * Containment is evaluated in memory by the zone registry, never in SQL, so the
 * polygon ring is stored as WKT text and parsed with JTS when the registry loads.
 * Circles keep their center and radii as plain columns.
 *
 * An empty vehicle and shipment scope means the zone applies to every vehicle
 * of the tenant.
 */
@Entity
@Table(
    name = "geofences",
    indexes = {
        @Index(name = "idx_geofence_tenant", columnList = "tenant_id"),
        @Index(name = "idx_geofence_tenant_active", columnList = "tenant_id, active")
    }
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Geofence {

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "tenant_id", nullable = false, length = 100)
    private String tenantId;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "shape_type", nullable = false, length = 20)
    private GeofenceShapeType shapeType;

    /**
     * Circle geometry (null for polygons)
     */
    @Column(name = "center_lat")
    private Double centerLat;

    @Column(name = "center_lon")
    private Double centerLon;

    @Column(name = "radius_m")
    private Double radiusM;

    /**
     * Optional hysteresis radii: entry requires the inner radius, exit the outer one
     */
    @Column(name = "inner_radius_m")
    private Double innerRadiusM;

    @Column(name = "outer_radius_m")
    private Double outerRadiusM;

    /**
     * Polygon ring in WKT, e.g. "POLYGON((77.59 12.97, ...))" (null for circles)
     */
    @Column(name = "polygon_wkt", columnDefinition = "TEXT")
    private String polygonWkt;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "geofence_vehicle_scope", joinColumns = @JoinColumn(name = "geofence_id"))
    @Column(name = "vehicle_id", length = 100)
    @Builder.Default
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Set<String> vehicleIds = new HashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "geofence_shipment_scope", joinColumns = @JoinColumn(name = "geofence_id"))
    @Column(name = "shipment_id", length = 100)
    @Builder.Default
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Set<String> shipmentIds = new HashSet<>();

    @Column(name = "on_entry", nullable = false)
    @Builder.Default
    private Boolean onEntry = true;

    @Column(name = "on_exit", nullable = false)
    @Builder.Default
    private Boolean onExit = true;

    @Column(nullable = false)
    @Builder.Default
    private Boolean active = true;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    /**
     * Builds the in-memory shape used by the zone registry.
     *
     * @throws IllegalArgumentException if the stored geometry is incomplete or invalid
     */
    public ZoneShape toShape() {
        if (shapeType == GeofenceShapeType.POLYGON) {
            if (polygonWkt == null || polygonWkt.isBlank()) {
                throw new IllegalArgumentException("Polygon geofence " + id + " has no ring");
            }
            return PolygonShape.fromWkt(polygonWkt);
        }
        if (centerLat == null || centerLon == null || radiusM == null) {
            throw new IllegalArgumentException("Circle geofence " + id + " is missing center or radius");
        }
        return new CircleShape(new GeoPoint(centerLat, centerLon), radiusM, innerRadiusM, outerRadiusM);
    }
}
