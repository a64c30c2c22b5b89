package com.logimatrix.tracking.service;

import com.logimatrix.tracking.config.TrackingProperties;
import com.logimatrix.tracking.dto.CachedAccidentZone;
import com.logimatrix.tracking.dto.CachedGeofence;
import com.logimatrix.tracking.dto.GeofenceRequest;
import com.logimatrix.tracking.dto.GeofenceView;
import com.logimatrix.tracking.dto.NearbyAccidentZone;
import com.logimatrix.tracking.entity.AccidentZone;
import com.logimatrix.tracking.geo.GeoPoint;
import com.logimatrix.tracking.repository.AccidentZoneRepository;
import com.logimatrix.tracking.repository.GeofenceRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Loads geofences and accident zones from the database into the zone registry
 * and owns geofence CRUD.
 *
 * Architecture:
 * 1. Warm-up: every active zone is indexed on startup
 * 2. Refresh: scheduled full reload (30 minutes by default) picks up rows
 *    changed by other services
 * 3. CRUD: a created or updated geofence is upserted into the registry once
 *    its row is committed; a geometry the registry cannot index is refused
 *    before anything is stored
 *
 * Geofence refresh and CRUD hold one lock from the database access to the
 * registry update, so a refresh never overwrites a change committed after its
 * read.
 *
 * Accident zones are maintained by the analytics pipeline and only read here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ZoneCatalogService {

    private final GeofenceRepository geofenceRepository;
    private final GeofenceWriter geofenceWriter;
    private final AccidentZoneRepository accidentZoneRepository;
    private final ZoneRegistry zoneRegistry;
    private final TrackingProperties properties;

    private final Object geofenceLock = new Object();

    /**
     * Registry warm-up on application startup.
     */
    @PostConstruct
    public void warmUp() {
        log.info("Starting zone registry warm-up...");
        long startTime = System.currentTimeMillis();

        try {
            int geofences = refreshGeofences();
            int accidentZones = refreshAccidentZones();
            log.info("Zone registry warm-up completed: {} geofences and {} accident zones in {}ms",
                geofences, accidentZones, System.currentTimeMillis() - startTime);
        } catch (Exception e) {
            log.error("Zone registry warm-up failed", e);
            // Don't throw - the scheduled refresh retries, and proximity evaluation
            // is skipped while the accident set was never loaded
        }
    }

    @Scheduled(fixedDelayString = "${tracking.registry.refresh-interval:PT30M}",
               initialDelayString = "${tracking.registry.refresh-interval:PT30M}")
    public void scheduledRefresh() {
        log.info("Starting scheduled zone registry refresh...");
        try {
            int geofences = refreshGeofences();
            int accidentZones = refreshAccidentZones();
            log.info("Scheduled zone registry refresh completed: {} geofences, {} accident zones",
                geofences, accidentZones);
        } catch (Exception e) {
            log.error("Scheduled zone registry refresh failed", e);
        }
    }

    /**
     * Replaces every geofence in the registry with the active rows. A row with
     * broken geometry is skipped and logged.
     *
     * @return number of geofences indexed
     */
    public int refreshGeofences() {
        synchronized (geofenceLock) {
            List<CachedGeofence> cached = geofenceWriter.loadActive();
            zoneRegistry.replaceGeofences(cached);
            return cached.size();
        }
    }

    /**
     * Replaces the accident-zone set and marks it freshly loaded.
     *
     * @return number of accident zones indexed
     */
    @Transactional(readOnly = true)
    public int refreshAccidentZones() {
        List<CachedAccidentZone> cached = new ArrayList<>();
        for (AccidentZone zone : accidentZoneRepository.findByActiveTrue()) {
            try {
                cached.add(CachedAccidentZone.fromEntity(zone, properties.getAccident()));
            } catch (RuntimeException e) {
                log.error("Failed to load accident zone {}: {}", zone.getId(), e.getMessage());
            }
        }
        if (cached.isEmpty()) {
            log.warn("No active accident zones found in database");
        }
        zoneRegistry.replaceAccidentZones(cached);
        return cached.size();
    }

    // ==================== Geofence CRUD ====================

    public GeofenceView createGeofence(GeofenceRequest request) {
        synchronized (geofenceLock) {
            GeofenceWriter.StoredGeofence stored = geofenceWriter.create(request);
            zoneRegistry.upsertGeofence(stored.cached());
            log.info("Created {}", stored.cached().toLogString());
            return stored.view();
        }
    }

    public GeofenceView updateGeofence(String id, GeofenceRequest request) {
        synchronized (geofenceLock) {
            GeofenceWriter.StoredGeofence stored = geofenceWriter.update(id, request);
            zoneRegistry.upsertGeofence(stored.cached());
            log.info("Updated {}", stored.cached().toLogString());
            return stored.view();
        }
    }

    @Transactional(readOnly = true)
    public GeofenceView getGeofence(String id) {
        return GeofenceView.from(geofenceWriter.findActive(id));
    }

    @Transactional(readOnly = true)
    public List<GeofenceView> listGeofences(String tenantId) {
        return geofenceRepository.findByTenantIdAndActiveTrueOrderByNameAsc(tenantId).stream()
            .map(GeofenceView::from)
            .toList();
    }

    /**
     * Soft delete: the row stays for audit, the registry forgets the zone.
     * Memberships of the zone are dropped without an exit edge.
     */
    public void deleteGeofence(String id) {
        synchronized (geofenceLock) {
            String tenantId = geofenceWriter.deactivate(id);
            zoneRegistry.removeGeofence(id);
            log.info("Deleted geofence {} of tenant {}", id, tenantId);
        }
    }

    // ==================== Accident zones ====================

    public List<CachedAccidentZone> accidentZones() {
        return zoneRegistry.snapshot().accidentZones().stream()
            .sorted(Comparator.comparing(CachedAccidentZone::zoneId))
            .toList();
    }

    /**
     * Accident zones whose center is within {@code radiusMeters}, nearest first.
     */
    public List<NearbyAccidentZone> nearbyAccidentZones(double lat, double lon, double radiusMeters) {
        if (!GeoPoint.of(lat, lon).isValid()) {
            throw new IllegalArgumentException("Invalid coordinate: " + lat + ", " + lon);
        }
        if (radiusMeters <= 0) {
            throw new IllegalArgumentException("radius must be > 0");
        }
        return zoneRegistry.snapshot().accidentZonesWithin(lat, lon, radiusMeters).stream()
            .map(zone -> NearbyAccidentZone.of(zone, zone.distanceTo(lat, lon)))
            .toList();
    }

    public ZoneRegistry.RegistryStats registryStats() {
        return zoneRegistry.stats();
    }
}
