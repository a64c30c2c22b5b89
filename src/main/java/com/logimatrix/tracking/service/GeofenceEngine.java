package com.logimatrix.tracking.service;

import com.logimatrix.tracking.config.TrackingProperties;
import com.logimatrix.tracking.dto.CachedGeofence;
import com.logimatrix.tracking.dto.FixRecord;
import com.logimatrix.tracking.dto.GeofenceEdge;
import com.logimatrix.tracking.dto.GeofenceEdgeKind;
import com.logimatrix.tracking.dto.GeofenceEvaluation;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Turns a fix into geofence memberships and entry/exit edges.
 *
 * Algorithm:
 * 1. Pull candidate geofences of the tenant from the snapshot (cell pre-filter)
 * 2. Add zones the vehicle is currently inside, so a large jump still produces an exit
 * 3. Drop zones whose scope no longer covers the vehicle or shipment (state is forgotten)
 * 4. Classify each zone, using hysteresis radii when the shape has them
 * 5. Emit an edge for every known-state change, subject to the zone's triggers
 *
 * The first classification of a (vehicle, zone) pair only records state.
 * Fixes whose accuracy is worse than the ceiling change nothing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GeofenceEngine {

    private final TrackingProperties properties;
    private final MeterRegistry meterRegistry;

    public GeofenceEvaluation evaluate(FixRecord fix, ZoneSnapshot snapshot, GeofenceMemberships memberships) {
        if (!fix.hasAcceptableAccuracy(properties.getGeofence().getAccuracyCeilingMeters())) {
            log.debug("Deferred geofence classification, accuracy {}m: {}", fix.accuracy(), fix.toLogString());
            return GeofenceEvaluation.deferred(memberships.insideZoneIds());
        }

        forgetRemovedZones(snapshot, memberships);

        Map<String, CachedGeofence> zones = new TreeMap<>();
        for (CachedGeofence zone : snapshot.geofenceCandidates(fix.tenantId(), fix.lat(), fix.lon())) {
            zones.put(zone.zoneId(), zone);
        }
        for (String zoneId : memberships.insideZoneIds()) {
            if (!zones.containsKey(zoneId)) {
                snapshot.geofence(zoneId).ifPresent(zone -> zones.put(zoneId, zone));
            }
        }

        long previousVersion = memberships.lastEvaluatedVersion();
        List<GeofenceEdge> edges = new ArrayList<>();

        for (CachedGeofence zone : zones.values()) {
            if (!zone.appliesTo(fix)) {
                memberships.remove(zone.zoneId());
                continue;
            }
            try {
                classify(fix, zone, memberships, snapshot, previousVersion).ifPresent(edges::add);
            } catch (RuntimeException e) {
                meterRegistry.counter("tracking.zone.evaluation.failed").increment();
                log.warn("Skipping geofence {} for {}: {}", zone.zoneId(), fix.toLogString(), e.getMessage());
            }
        }

        memberships.markEvaluated(snapshot.version());
        edges.sort(Comparator.comparing(GeofenceEdge::zoneId));

        if (!edges.isEmpty()) {
            log.info("Geofence edges for vehicle {}: {}", fix.vehicleId(),
                edges.stream().map(GeofenceEdge::toLogString).toList());
        }
        return new GeofenceEvaluation(memberships.insideZoneIds(), edges, false);
    }

    private Optional<GeofenceEdge> classify(FixRecord fix,
                                            CachedGeofence zone,
                                            GeofenceMemberships memberships,
                                            ZoneSnapshot snapshot,
                                            long previousVersion) {
        ZoneMembership prior = memberships.get(zone.zoneId());
        if (prior == null && previousVersion >= 0 && snapshot.geofenceVersion(zone.zoneId()) <= previousVersion
            && snapshot.geofenceVersion(zone.zoneId()) >= 0) {
            // Indexed before the previous evaluation but not a candidate then: it was outside
            prior = ZoneMembership.OUTSIDE;
        }

        Boolean wasInside = prior == null ? null : prior == ZoneMembership.INSIDE;
        boolean inside = zone.shape().classify(fix.lat(), fix.lon(), wasInside);
        ZoneMembership now = inside ? ZoneMembership.INSIDE : ZoneMembership.OUTSIDE;
        memberships.put(zone.zoneId(), now);

        if (prior == null || prior == now) {
            return Optional.empty();
        }
        if (now == ZoneMembership.INSIDE && zone.onEntry()) {
            return Optional.of(new GeofenceEdge(zone.zoneId(), zone.name(), GeofenceEdgeKind.ENTRY));
        }
        if (now == ZoneMembership.OUTSIDE && zone.onExit()) {
            return Optional.of(new GeofenceEdge(zone.zoneId(), zone.name(), GeofenceEdgeKind.EXIT));
        }
        return Optional.empty();
    }

    private void forgetRemovedZones(ZoneSnapshot snapshot, GeofenceMemberships memberships) {
        Set<String> removed = new HashSet<>();
        for (String zoneId : memberships.states().keySet()) {
            if (snapshot.geofence(zoneId).isEmpty()) {
                removed.add(zoneId);
            }
        }
        removed.forEach(memberships::remove);
    }
}
