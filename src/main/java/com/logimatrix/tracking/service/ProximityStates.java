package com.logimatrix.tracking.service;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Accident-proximity debounce state of one vehicle.
 *
 * Only zones in the {@code active} phase are stored; an absent zone is idle.
 * Not thread-safe: owned by the vehicle's serialization context.
 */
public class ProximityStates {

    private final Map<String, Active> active = new HashMap<>();

    public Optional<Active> get(String zoneId) {
        return Optional.ofNullable(active.get(zoneId));
    }

    public boolean isActive(String zoneId) {
        return active.containsKey(zoneId);
    }

    public Collection<Active> activeZones() {
        return active.values();
    }

    /**
     * Restores an active state read back from the alert log.
     */
    public void restore(String zoneId, Instant activatedAt) {
        active.putIfAbsent(zoneId, new Active(zoneId, activatedAt, activatedAt));
    }

    void activate(String zoneId, Instant ts) {
        active.put(zoneId, new Active(zoneId, ts, ts));
    }

    void markInside(String zoneId, Instant ts) {
        active.computeIfPresent(zoneId, (id, state) -> new Active(id, state.activatedAt(), ts));
    }

    void release(String zoneId) {
        active.remove(zoneId);
    }

    public int size() {
        return active.size();
    }

    /**
     * @param activatedAt  fix timestamp of the idle-to-active transition (last transition)
     * @param lastInsideTs fix timestamp of the latest fix inside the zone's radius
     */
    public record Active(String zoneId, Instant activatedAt, Instant lastInsideTs) {
    }
}
