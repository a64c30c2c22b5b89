package com.logimatrix.tracking.dto;

import com.logimatrix.tracking.entity.AccidentSeverity;
import com.logimatrix.tracking.geo.GeoPoint;

import java.util.Locale;

/**
 * A vehicle entered the alert radius of an accident zone and the debounce
 * state moved from idle to active.
 */
public record ProximityActivation(
    String zoneId,
    AccidentSeverity severity,
    int accidentCount,
    double distanceM,
    double radiusM,
    GeoPoint zoneCenter
) {

    /**
     * Message shown to the driver, e.g.
     * "Caution: high-risk accident zone 250m ahead. 12 accidents reported here."
     */
    public String driverMessage() {
        String prefix = switch (severity) {
            case HIGH -> "Caution: high-risk accident zone";
            case MEDIUM -> "Warning: accident-prone zone";
            case LOW -> "Notice: accident zone";
        };
        return String.format(Locale.ROOT, "%s %dm ahead. %d accident%s reported here.",
            prefix, Math.round(distanceM), accidentCount, accidentCount == 1 ? "" : "s");
    }

    public String toLogString() {
        return String.format(Locale.ROOT, "Proximity[zone=%s, severity=%s, distance=%.1fm]",
            zoneId, severity.wireName(), distanceM);
    }
}
