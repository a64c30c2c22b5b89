package com.logimatrix.tracking.service;

import com.logimatrix.tracking.dto.CachedAccidentZone;
import com.logimatrix.tracking.dto.CachedGeofence;
import com.logimatrix.tracking.exception.ZoneRegistryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Tenant-scoped geofences and the global accident-zone set, indexed in memory.
 *
 * Concurrency model:
 * - Readers call {@link #snapshot()} and work on an immutable {@link ZoneSnapshot}; they never block.
 * - Writers are serialized, copy only the maps and cells their change touches,
 *   and publish the new snapshot with a single atomic swap.
 * - If building the new snapshot fails, the swap never happens and the previous
 *   snapshot stays active; the caller gets a {@link ZoneRegistryException}.
 */
@Service
@Slf4j
public class ZoneRegistry {

    private final H3CellIndexer indexer;
    private final Clock clock;
    private final AtomicReference<ZoneSnapshot> current;
    private final Object writeLock = new Object();

    public ZoneRegistry(H3CellIndexer indexer, Clock clock) {
        this.indexer = indexer;
        this.clock = clock;
        this.current = new AtomicReference<>(ZoneSnapshot.empty(indexer, clock.instant()));
    }

    public ZoneSnapshot snapshot() {
        return current.get();
    }

    /**
     * Candidate geofences of the tenant plus candidate accident zones for a coordinate.
     */
    public ZoneCandidates candidates(String tenantId, double lat, double lon) {
        ZoneSnapshot snapshot = snapshot();
        return new ZoneCandidates(
            snapshot.geofenceCandidates(tenantId, lat, lon),
            snapshot.accidentCandidates(lat, lon)
        );
    }

    public void upsertGeofence(CachedGeofence geofence) {
        update("upsert geofence " + geofence.zoneId(), draft -> {
            draft.removeGeofence(geofence.zoneId());
            draft.addGeofence(geofence);
        });
        log.debug("Indexed {}", geofence.toLogString());
    }

    public boolean removeGeofence(String zoneId) {
        boolean present = snapshot().geofence(zoneId).isPresent();
        if (present) {
            update("remove geofence " + zoneId, draft -> draft.removeGeofence(zoneId));
        }
        return present;
    }

    /**
     * Replaces every geofence of every tenant.
     */
    public void replaceGeofences(Collection<CachedGeofence> geofences) {
        update("replace " + geofences.size() + " geofences", draft -> {
            draft.clearGeofences();
            geofences.forEach(draft::addGeofence);
        });
    }

    public void upsertAccidentZone(CachedAccidentZone zone) {
        update("upsert accident zone " + zone.zoneId(), draft -> {
            draft.removeAccidentZone(zone.zoneId());
            draft.addAccidentZone(zone);
        });
    }

    public boolean removeAccidentZone(String zoneId) {
        boolean present = snapshot().accidentZone(zoneId).isPresent();
        if (present) {
            update("remove accident zone " + zoneId, draft -> draft.removeAccidentZone(zoneId));
        }
        return present;
    }

    /**
     * Replaces the whole accident-zone set and marks it freshly loaded.
     */
    public void replaceAccidentZones(Collection<CachedAccidentZone> zones) {
        update("replace " + zones.size() + " accident zones", draft -> {
            draft.clearAccidentZones();
            zones.forEach(draft::addAccidentZone);
            draft.accidentZonesLoadedAt = clock.instant();
        });
    }

    public RegistryStats stats() {
        ZoneSnapshot snapshot = snapshot();
        return new RegistryStats(
            snapshot.version(),
            snapshot.geofenceCount(),
            snapshot.accidentZoneCount(),
            snapshot.oversizedZoneCount(),
            snapshot.createdAt(),
            snapshot.accidentZonesLoadedAt(),
            indexer.getResolution()
        );
    }

    private void update(String description, Consumer<Draft> change) {
        synchronized (writeLock) {
            ZoneSnapshot base = current.get();
            ZoneSnapshot next;
            try {
                Draft draft = new Draft(base);
                change.accept(draft);
                next = draft.freeze(clock.instant());
            } catch (RuntimeException e) {
                log.error("Zone registry update failed ({}), keeping snapshot v{}", description, base.version(), e);
                throw new ZoneRegistryException("Zone registry update failed: " + description, e);
            }
            current.set(next);
            log.debug("Zone registry v{} -> v{}: {}", base.version(), next.version(), description);
        }
    }

    /**
     * Candidates of one lookup.
     */
    public record ZoneCandidates(List<CachedGeofence> geofences, List<CachedAccidentZone> accidentZones) {
    }

    public record RegistryStats(
        long version,
        int geofenceCount,
        int accidentZoneCount,
        int oversizedZoneCount,
        Instant snapshotCreatedAt,
        Instant accidentZonesLoadedAt,
        int h3Resolution
    ) {
    }

    /**
     * Mutable working copy of a snapshot. Outer maps are copied eagerly; per-tenant
     * cell maps and per-cell lists are copied the first time a change touches them,
     * so the base snapshot is never mutated.
     */
    private final class Draft {

        private final Map<String, CachedGeofence> geofencesById;
        private final Map<String, Map<Long, List<CachedGeofence>>> geofenceCellsByTenant;
        private final Map<String, List<CachedGeofence>> oversizedGeofencesByTenant;
        private final Map<String, List<Long>> geofenceCovers;
        private final Map<String, Long> geofenceVersions;
        private final Set<String> copiedTenants = new HashSet<>();
        private final long version;

        private final Map<String, CachedAccidentZone> accidentZonesById;
        private Map<Long, List<CachedAccidentZone>> accidentCells;
        private List<CachedAccidentZone> oversizedAccidentZones;
        private final Map<String, List<Long>> accidentCovers;
        private Instant accidentZonesLoadedAt;

        Draft(ZoneSnapshot base) {
            this.version = base.version() + 1;
            this.geofenceVersions = new HashMap<>(base.geofenceVersions());
            this.geofencesById = new HashMap<>(base.geofencesById());
            this.geofenceCellsByTenant = new HashMap<>(base.geofenceCellsByTenant());
            this.oversizedGeofencesByTenant = new HashMap<>(base.oversizedGeofencesByTenant());
            this.geofenceCovers = new HashMap<>(base.geofenceCovers());
            this.accidentZonesById = new HashMap<>(base.accidentZonesById());
            this.accidentCells = new HashMap<>(base.accidentCells());
            this.oversizedAccidentZones = base.oversizedAccidentZones();
            this.accidentCovers = new HashMap<>(base.accidentCovers());
            this.accidentZonesLoadedAt = base.accidentZonesLoadedAt();
        }

        void addGeofence(CachedGeofence zone) {
            Optional<List<Long>> cover = indexer.coverCells(zone.shape().boundingCenter(), zone.shape().boundingRadiusMeters());
            geofencesById.put(zone.zoneId(), zone);
            geofenceVersions.put(zone.zoneId(), version);
            if (cover.isEmpty()) {
                List<CachedGeofence> oversized = new ArrayList<>(
                    oversizedGeofencesByTenant.getOrDefault(zone.tenantId(), List.of()));
                oversized.add(zone);
                oversizedGeofencesByTenant.put(zone.tenantId(), oversized);
                log.info("Geofence {} is too large for the cell index, checked on every lookup", zone.zoneId());
                return;
            }
            Map<Long, List<CachedGeofence>> cells = tenantCells(zone.tenantId());
            for (long cell : cover.get()) {
                List<CachedGeofence> zones = new ArrayList<>(cells.getOrDefault(cell, List.of()));
                zones.add(zone);
                cells.put(cell, zones);
            }
            geofenceCovers.put(zone.zoneId(), cover.get());
        }

        void removeGeofence(String zoneId) {
            CachedGeofence old = geofencesById.remove(zoneId);
            if (old == null) {
                return;
            }
            geofenceVersions.remove(zoneId);
            List<Long> cover = geofenceCovers.remove(zoneId);
            if (cover == null) {
                List<CachedGeofence> oversized = new ArrayList<>(
                    oversizedGeofencesByTenant.getOrDefault(old.tenantId(), List.of()));
                oversized.removeIf(zone -> zone.zoneId().equals(zoneId));
                if (oversized.isEmpty()) {
                    oversizedGeofencesByTenant.remove(old.tenantId());
                } else {
                    oversizedGeofencesByTenant.put(old.tenantId(), oversized);
                }
                return;
            }
            Map<Long, List<CachedGeofence>> cells = tenantCells(old.tenantId());
            for (long cell : cover) {
                List<CachedGeofence> zones = new ArrayList<>(cells.getOrDefault(cell, List.of()));
                zones.removeIf(zone -> zone.zoneId().equals(zoneId));
                if (zones.isEmpty()) {
                    cells.remove(cell);
                } else {
                    cells.put(cell, zones);
                }
            }
            if (cells.isEmpty()) {
                geofenceCellsByTenant.remove(old.tenantId());
            }
        }

        void clearGeofences() {
            geofencesById.clear();
            geofenceCellsByTenant.clear();
            oversizedGeofencesByTenant.clear();
            geofenceCovers.clear();
            geofenceVersions.clear();
            copiedTenants.clear();
        }

        void addAccidentZone(CachedAccidentZone zone) {
            Optional<List<Long>> cover = indexer.coverCells(zone.center(), zone.radiusM());
            accidentZonesById.put(zone.zoneId(), zone);
            if (cover.isEmpty()) {
                List<CachedAccidentZone> oversized = new ArrayList<>(oversizedAccidentZones);
                oversized.add(zone);
                oversizedAccidentZones = oversized;
                return;
            }
            for (long cell : cover.get()) {
                List<CachedAccidentZone> zones = new ArrayList<>(accidentCells.getOrDefault(cell, List.of()));
                zones.add(zone);
                accidentCells.put(cell, zones);
            }
            accidentCovers.put(zone.zoneId(), cover.get());
        }

        void removeAccidentZone(String zoneId) {
            if (accidentZonesById.remove(zoneId) == null) {
                return;
            }
            List<Long> cover = accidentCovers.remove(zoneId);
            if (cover == null) {
                List<CachedAccidentZone> oversized = new ArrayList<>(oversizedAccidentZones);
                oversized.removeIf(zone -> zone.zoneId().equals(zoneId));
                oversizedAccidentZones = oversized;
                return;
            }
            for (long cell : cover) {
                List<CachedAccidentZone> zones = new ArrayList<>(accidentCells.getOrDefault(cell, List.of()));
                zones.removeIf(zone -> zone.zoneId().equals(zoneId));
                if (zones.isEmpty()) {
                    accidentCells.remove(cell);
                } else {
                    accidentCells.put(cell, zones);
                }
            }
        }

        void clearAccidentZones() {
            accidentZonesById.clear();
            accidentCells = new HashMap<>();
            oversizedAccidentZones = List.of();
            accidentCovers.clear();
        }

        private Map<Long, List<CachedGeofence>> tenantCells(String tenantId) {
            Map<Long, List<CachedGeofence>> cells = geofenceCellsByTenant.get(tenantId);
            if (copiedTenants.add(tenantId) || cells == null) {
                cells = cells == null ? new HashMap<>() : new HashMap<>(cells);
                geofenceCellsByTenant.put(tenantId, cells);
            }
            return cells;
        }

        ZoneSnapshot freeze(Instant now) {
            return new ZoneSnapshot(
                version,
                now,
                accidentZonesLoadedAt,
                indexer,
                Collections.unmodifiableMap(geofencesById),
                Collections.unmodifiableMap(geofenceCellsByTenant),
                Collections.unmodifiableMap(oversizedGeofencesByTenant),
                Collections.unmodifiableMap(geofenceCovers),
                Collections.unmodifiableMap(geofenceVersions),
                Collections.unmodifiableMap(accidentZonesById),
                Collections.unmodifiableMap(accidentCells),
                List.copyOf(oversizedAccidentZones),
                Collections.unmodifiableMap(accidentCovers)
            );
        }
    }
}
