package com.logimatrix.tracking.dto;

import com.logimatrix.tracking.config.TrackingProperties;
import com.logimatrix.tracking.entity.AccidentSeverity;
import com.logimatrix.tracking.entity.AccidentZone;
import com.logimatrix.tracking.geo.GeoPoint;

/**
 * In-memory accident zone held by the zone registry.
 *
 * @param radiusM alert radius, from the row override or derived from the severity
 */
public record CachedAccidentZone(
    String zoneId,
    String name,
    GeoPoint center,
    AccidentSeverity severity,
    int accidentCount,
    double radiusM
) {

    public static CachedAccidentZone fromEntity(AccidentZone zone, TrackingProperties.Accident settings) {
        double radius = zone.getRadiusM() != null && zone.getRadiusM() > 0
            ? zone.getRadiusM()
            : settings.radiusFor(zone.getSeverity());
        return new CachedAccidentZone(
            zone.getId(),
            zone.getName(),
            new GeoPoint(zone.getCenterLat(), zone.getCenterLon()),
            zone.getSeverity(),
            zone.getAccidentCount() != null ? zone.getAccidentCount() : 0,
            radius
        );
    }

    public double distanceTo(double lat, double lon) {
        return center.distanceTo(new GeoPoint(lat, lon));
    }
}
