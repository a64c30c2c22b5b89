package com.logimatrix.tracking.dto;

import java.util.List;
import java.util.Map;

/**
 * Alert statistics of one vehicle over a trailing window.
 *
 * @param bySeverity counts keyed by severity; geofence alerts count under "geofence"
 * @param topZones   zones that alerted most often, at most five
 */
public record AlertStats(
    String vehicleId,
    int hours,
    long total,
    Map<String, Long> bySeverity,
    List<ZoneCount> topZones
) {

    public record ZoneCount(String zoneId, String zoneName, long count) {
    }
}
