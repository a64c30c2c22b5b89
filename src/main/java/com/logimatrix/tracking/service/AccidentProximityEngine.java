package com.logimatrix.tracking.service;

import com.logimatrix.tracking.config.TrackingProperties;
import com.logimatrix.tracking.dto.CachedAccidentZone;
import com.logimatrix.tracking.dto.FixRecord;
import com.logimatrix.tracking.dto.ProximityActivation;
import com.logimatrix.tracking.dto.ProximityEvaluation;
import com.logimatrix.tracking.dto.ProximityResolution;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Nearest-accident-zone proximity with per (vehicle, zone) debounce.
 *
 * State machine per (vehicle, accident zone):
 * - idle -> active on the first fix within the zone's radius, if the zone is the nearest
 *   qualifying one. Only this transition emits an alert.
 * - active -> idle once the vehicle has been outside the radius for exitHold
 *   (measured from the last fix inside), or activeMax after activation.
 *
 * Scoring: the nearest zone wins; distances within the tie tolerance are broken
 * by severity, then by accident count.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccidentProximityEngine {

    private final TrackingProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public ProximityEvaluation evaluate(FixRecord fix, ZoneSnapshot snapshot, ProximityStates states) {
        TrackingProperties.Accident settings = properties.getAccident();

        if (snapshot.isAccidentSetStale(clock.instant(), settings.getMaxSnapshotAge())) {
            meterRegistry.counter("tracking.accident.skipped.stale-registry").increment();
            log.warn("Accident zones loaded at {} are stale, skipping proximity for {}",
                snapshot.accidentZonesLoadedAt(), fix.toLogString());
            return ProximityEvaluation.skippedEvaluation();
        }

        Map<String, Double> withinRadius = new HashMap<>();
        List<CachedAccidentZone> qualifying = new ArrayList<>();
        for (CachedAccidentZone zone : snapshot.accidentCandidates(fix.lat(), fix.lon())) {
            try {
                double distance = zone.distanceTo(fix.lat(), fix.lon());
                if (distance <= zone.radiusM()) {
                    withinRadius.put(zone.zoneId(), distance);
                    qualifying.add(zone);
                }
            } catch (RuntimeException e) {
                meterRegistry.counter("tracking.zone.evaluation.failed").increment();
                log.warn("Skipping accident zone {} for {}: {}", zone.zoneId(), fix.toLogString(), e.getMessage());
            }
        }

        List<ProximityResolution> resolutions = advanceActiveStates(fix, states, withinRadius.keySet(), settings);
        Set<String> resolvedNow = new HashSet<>();
        resolutions.forEach(resolution -> resolvedNow.add(resolution.zoneId()));

        ProximityActivation activation = null;
        CachedAccidentZone nearest = pickNearest(qualifying, withinRadius, settings.getTieToleranceMeters());
        if (nearest != null && !states.isActive(nearest.zoneId()) && !resolvedNow.contains(nearest.zoneId())) {
            states.activate(nearest.zoneId(), fix.ts());
            activation = new ProximityActivation(
                nearest.zoneId(),
                nearest.severity(),
                nearest.accidentCount(),
                withinRadius.get(nearest.zoneId()),
                nearest.radiusM(),
                nearest.center()
            );
            log.info("Accident proximity for vehicle {}: {}", fix.vehicleId(), activation.toLogString());
        }

        return new ProximityEvaluation(activation, resolutions, false);
    }

    private List<ProximityResolution> advanceActiveStates(FixRecord fix,
                                                          ProximityStates states,
                                                          Set<String> insideZoneIds,
                                                          TrackingProperties.Accident settings) {
        Duration exitHold = settings.getExitHold();
        Duration activeMax = settings.getActiveMax();
        List<ProximityResolution> resolutions = new ArrayList<>();

        for (ProximityStates.Active state : List.copyOf(states.activeZones())) {
            String zoneId = state.zoneId();
            boolean inside = insideZoneIds.contains(zoneId);
            Instant lastInside = inside ? fix.ts() : state.lastInsideTs();

            if (!Duration.between(state.activatedAt(), fix.ts()).minus(activeMax).isNegative()) {
                resolutions.add(new ProximityResolution(zoneId, state.activatedAt(), fix.ts(), ProximityResolution.ACTIVE_MAX));
            } else if (!inside && !Duration.between(lastInside, fix.ts()).minus(exitHold).isNegative()) {
                resolutions.add(new ProximityResolution(zoneId, state.activatedAt(), fix.ts(), ProximityResolution.EXIT_HOLD));
            } else {
                if (inside) {
                    states.markInside(zoneId, fix.ts());
                }
                continue;
            }
            states.release(zoneId);
            log.info("Accident proximity for vehicle {} zone {} back to idle ({})",
                fix.vehicleId(), zoneId, resolutions.get(resolutions.size() - 1).reason());
        }
        return resolutions;
    }

    private CachedAccidentZone pickNearest(List<CachedAccidentZone> qualifying,
                                           Map<String, Double> distances,
                                           double tieTolerance) {
        if (qualifying.isEmpty()) {
            return null;
        }
        List<CachedAccidentZone> byDistance = new ArrayList<>(qualifying);
        byDistance.sort(Comparator.comparingDouble(zone -> distances.get(zone.zoneId())));
        double nearestDistance = distances.get(byDistance.get(0).zoneId());

        return byDistance.stream()
            .filter(zone -> distances.get(zone.zoneId()) - nearestDistance <= tieTolerance)
            .min(Comparator
                .comparingInt((CachedAccidentZone zone) -> -zone.severity().rank())
                .thenComparingInt(zone -> -zone.accidentCount())
                .thenComparingDouble(zone -> distances.get(zone.zoneId()))
                .thenComparing(CachedAccidentZone::zoneId))
            .orElse(null);
    }
}
