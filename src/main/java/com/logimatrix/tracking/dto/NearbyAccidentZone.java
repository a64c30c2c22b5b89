package com.logimatrix.tracking.dto;

import com.logimatrix.tracking.entity.AccidentSeverity;
import com.logimatrix.tracking.geo.GeoPoint;

/**
 * Accident zone returned by a nearby lookup, with its distance from the query point.
 */
public record NearbyAccidentZone(
    String zoneId,
    String name,
    GeoPoint center,
    AccidentSeverity severity,
    int accidentCount,
    double radiusM,
    double distanceM
) {

    public static NearbyAccidentZone of(CachedAccidentZone zone, double distanceM) {
        return new NearbyAccidentZone(zone.zoneId(), zone.name(), zone.center(), zone.severity(),
            zone.accidentCount(), zone.radiusM(), distanceM);
    }
}
