package com.logimatrix.tracking.service;

import com.logimatrix.tracking.dto.CachedAccidentZone;
import com.logimatrix.tracking.dto.CachedGeofence;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of every indexed zone at one registry version.
 *
 * One fix evaluation reads one snapshot, so concurrent upserts never change the
 * zone set halfway through an evaluation. A snapshot stays reachable only as
 * long as an evaluation holds it.
 */
public final class ZoneSnapshot {

    private final long version;
    private final Instant createdAt;
    private final Instant accidentZonesLoadedAt;
    private final H3CellIndexer indexer;

    private final Map<String, CachedGeofence> geofencesById;
    private final Map<String, Map<Long, List<CachedGeofence>>> geofenceCellsByTenant;
    private final Map<String, List<CachedGeofence>> oversizedGeofencesByTenant;
    private final Map<String, List<Long>> geofenceCovers;
    private final Map<String, Long> geofenceVersions;

    private final Map<String, CachedAccidentZone> accidentZonesById;
    private final Map<Long, List<CachedAccidentZone>> accidentCells;
    private final List<CachedAccidentZone> oversizedAccidentZones;
    private final Map<String, List<Long>> accidentCovers;

    ZoneSnapshot(long version,
                 Instant createdAt,
                 Instant accidentZonesLoadedAt,
                 H3CellIndexer indexer,
                 Map<String, CachedGeofence> geofencesById,
                 Map<String, Map<Long, List<CachedGeofence>>> geofenceCellsByTenant,
                 Map<String, List<CachedGeofence>> oversizedGeofencesByTenant,
                 Map<String, List<Long>> geofenceCovers,
                 Map<String, Long> geofenceVersions,
                 Map<String, CachedAccidentZone> accidentZonesById,
                 Map<Long, List<CachedAccidentZone>> accidentCells,
                 List<CachedAccidentZone> oversizedAccidentZones,
                 Map<String, List<Long>> accidentCovers) {
        this.version = version;
        this.createdAt = createdAt;
        this.accidentZonesLoadedAt = accidentZonesLoadedAt;
        this.indexer = indexer;
        this.geofencesById = geofencesById;
        this.geofenceCellsByTenant = geofenceCellsByTenant;
        this.oversizedGeofencesByTenant = oversizedGeofencesByTenant;
        this.geofenceCovers = geofenceCovers;
        this.geofenceVersions = geofenceVersions;
        this.accidentZonesById = accidentZonesById;
        this.accidentCells = accidentCells;
        this.oversizedAccidentZones = oversizedAccidentZones;
        this.accidentCovers = accidentCovers;
    }

    static ZoneSnapshot empty(H3CellIndexer indexer, Instant now) {
        return new ZoneSnapshot(0, now, null, indexer,
            Map.of(), Map.of(), Map.of(), Map.of(), Map.of(),
            Map.of(), Map.of(), List.of(), Map.of());
    }

    /**
     * Candidate geofences of the tenant for a coordinate. Candidates share an
     * index cell with the coordinate; the caller still runs the exact shape test.
     */
    public List<CachedGeofence> geofenceCandidates(String tenantId, double lat, double lon) {
        Map<Long, List<CachedGeofence>> cells = geofenceCellsByTenant.getOrDefault(tenantId, Map.of());
        List<CachedGeofence> oversized = oversizedGeofencesByTenant.getOrDefault(tenantId, List.of());
        if (cells.isEmpty() && oversized.isEmpty()) {
            return List.of();
        }
        Map<String, CachedGeofence> candidates = new LinkedHashMap<>();
        for (long cell : indexer.lookupCells(lat, lon)) {
            for (CachedGeofence zone : cells.getOrDefault(cell, List.of())) {
                candidates.putIfAbsent(zone.zoneId(), zone);
            }
        }
        for (CachedGeofence zone : oversized) {
            candidates.putIfAbsent(zone.zoneId(), zone);
        }
        return new ArrayList<>(candidates.values());
    }

    /**
     * Candidate accident zones for a coordinate, across all tenants.
     */
    public List<CachedAccidentZone> accidentCandidates(double lat, double lon) {
        if (accidentZonesById.isEmpty()) {
            return List.of();
        }
        Map<String, CachedAccidentZone> candidates = new LinkedHashMap<>();
        for (long cell : indexer.lookupCells(lat, lon)) {
            for (CachedAccidentZone zone : accidentCells.getOrDefault(cell, List.of())) {
                candidates.putIfAbsent(zone.zoneId(), zone);
            }
        }
        for (CachedAccidentZone zone : oversizedAccidentZones) {
            candidates.putIfAbsent(zone.zoneId(), zone);
        }
        return new ArrayList<>(candidates.values());
    }

    /**
     * Accident zones whose center lies within {@code radiusMeters}, nearest first.
     */
    public List<CachedAccidentZone> accidentZonesWithin(double lat, double lon, double radiusMeters) {
        return accidentZonesById.values().stream()
            .filter(zone -> zone.distanceTo(lat, lon) <= radiusMeters)
            .sorted(Comparator.comparingDouble(zone -> zone.distanceTo(lat, lon)))
            .toList();
    }

    public Optional<CachedGeofence> geofence(String zoneId) {
        return Optional.ofNullable(geofencesById.get(zoneId));
    }

    /**
     * Registry version at which the geofence was last indexed, -1 if unknown.
     */
    public long geofenceVersion(String zoneId) {
        return geofenceVersions.getOrDefault(zoneId, -1L);
    }

    public Optional<CachedAccidentZone> accidentZone(String zoneId) {
        return Optional.ofNullable(accidentZonesById.get(zoneId));
    }

    public Collection<CachedAccidentZone> accidentZones() {
        return accidentZonesById.values();
    }

    /**
     * Accident zones are stale when they were never loaded or were loaded
     * longer than {@code maxAge} ago.
     */
    public boolean isAccidentSetStale(Instant now, Duration maxAge) {
        return accidentZonesLoadedAt == null || accidentZonesLoadedAt.plus(maxAge).isBefore(now);
    }

    public long version() {
        return version;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant accidentZonesLoadedAt() {
        return accidentZonesLoadedAt;
    }

    public int geofenceCount() {
        return geofencesById.size();
    }

    public int accidentZoneCount() {
        return accidentZonesById.size();
    }

    public int oversizedZoneCount() {
        return oversizedAccidentZones.size()
            + oversizedGeofencesByTenant.values().stream().mapToInt(List::size).sum();
    }

    // Package-private accessors for the registry's copy-on-write updates

    Map<String, CachedGeofence> geofencesById() {
        return geofencesById;
    }

    Map<String, Map<Long, List<CachedGeofence>>> geofenceCellsByTenant() {
        return geofenceCellsByTenant;
    }

    Map<String, List<CachedGeofence>> oversizedGeofencesByTenant() {
        return oversizedGeofencesByTenant;
    }

    Map<String, List<Long>> geofenceCovers() {
        return geofenceCovers;
    }

    Map<String, Long> geofenceVersions() {
        return geofenceVersions;
    }

    Map<String, CachedAccidentZone> accidentZonesById() {
        return accidentZonesById;
    }

    Map<Long, List<CachedAccidentZone>> accidentCells() {
        return accidentCells;
    }

    List<CachedAccidentZone> oversizedAccidentZones() {
        return oversizedAccidentZones;
    }

    Map<String, List<Long>> accidentCovers() {
        return accidentCovers;
    }

    H3CellIndexer indexer() {
        return indexer;
    }
}
