package com.logimatrix.tracking.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * Curated accident-prone area. Read-only for the tracking engine: rows are
 * maintained by the accident curation pipeline and loaded into the zone registry.
 *
 * The alert radius is derived from the severity by configuration unless the row
 * carries an explicit {@code radius_m}.
 */
@Entity
@Table(
    name = "accident_zones",
    indexes = {
        @Index(name = "idx_accident_zone_active", columnList = "active"),
        @Index(name = "idx_accident_zone_severity", columnList = "severity")
    }
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AccidentZone {

    @Id
    @Column(length = 64)
    private String id;

    private String name;

    @Column(name = "center_lat", nullable = false)
    private Double centerLat;

    @Column(name = "center_lon", nullable = false)
    private Double centerLon;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AccidentSeverity severity;

    @Column(name = "accident_count", nullable = false)
    @Builder.Default
    private Integer accidentCount = 0;

    /**
     * Optional override of the severity-derived alert radius
     */
    @Column(name = "radius_m")
    private Double radiusM;

    @Column(nullable = false)
    @Builder.Default
    private Boolean active = true;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
