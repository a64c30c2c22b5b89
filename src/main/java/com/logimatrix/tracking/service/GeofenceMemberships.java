package com.logimatrix.tracking.service;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Membership state of one vehicle across its tenant's geofences.
 *
 * Only zones that were candidates at some evaluation carry an explicit state.
 * A zone without state that already existed at the vehicle's previous
 * evaluation was implicitly outside (it was not a candidate), so
 * {@link #lastEvaluatedVersion} lets the engine tell that case apart from a
 * genuine first classification.
 *
 * Not thread-safe: owned by the vehicle's serialization context.
 */
public class GeofenceMemberships {

    private final Map<String, ZoneMembership> states = new HashMap<>();
    private long lastEvaluatedVersion = -1;

    public ZoneMembership get(String zoneId) {
        return states.get(zoneId);
    }

    void put(String zoneId, ZoneMembership membership) {
        states.put(zoneId, membership);
    }

    void remove(String zoneId) {
        states.remove(zoneId);
    }

    Map<String, ZoneMembership> states() {
        return states;
    }

    public Set<String> insideZoneIds() {
        Set<String> inside = new TreeSet<>();
        states.forEach((zoneId, membership) -> {
            if (membership == ZoneMembership.INSIDE) {
                inside.add(zoneId);
            }
        });
        return inside;
    }

    public long lastEvaluatedVersion() {
        return lastEvaluatedVersion;
    }

    void markEvaluated(long version) {
        this.lastEvaluatedVersion = version;
    }

    public int size() {
        return states.size();
    }
}
