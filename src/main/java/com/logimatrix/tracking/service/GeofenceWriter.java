package com.logimatrix.tracking.service;

import com.logimatrix.tracking.dto.CachedGeofence;
import com.logimatrix.tracking.dto.GeofenceRequest;
import com.logimatrix.tracking.dto.GeofenceView;
import com.logimatrix.tracking.entity.Geofence;
import com.logimatrix.tracking.entity.GeofenceShapeType;
import com.logimatrix.tracking.exception.ZoneNotFoundException;
import com.logimatrix.tracking.geo.PolygonShape;
import com.logimatrix.tracking.repository.GeofenceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.UUID;

/**
 * Transactional geofence reads and writes. Kept apart from
 * {@link ZoneCatalogService} so each call commits before the catalog touches
 * the zone registry.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GeofenceWriter {

    private final GeofenceRepository geofenceRepository;

    /**
     * Active geofences in registry form. A row with broken geometry is skipped and logged.
     */
    @Transactional(readOnly = true)
    public List<CachedGeofence> loadActive() {
        List<CachedGeofence> cached = new ArrayList<>();
        for (Geofence geofence : geofenceRepository.findByActiveTrue()) {
            try {
                cached.add(CachedGeofence.fromEntity(geofence));
            } catch (RuntimeException e) {
                log.error("Failed to load geofence {}: {}", geofence.getId(), e.getMessage());
            }
        }
        return cached;
    }

    /**
     * @throws IllegalArgumentException if the geometry is incomplete or invalid; nothing is stored
     */
    @Transactional
    public StoredGeofence create(GeofenceRequest request) {
        Geofence geofence = new Geofence();
        geofence.setId(UUID.randomUUID().toString());
        return store(geofence, request);
    }

    @Transactional
    public StoredGeofence update(String id, GeofenceRequest request) {
        return store(findActive(id), request);
    }

    /**
     * Soft delete: the row stays for audit.
     *
     * @return the tenant of the deleted geofence
     */
    @Transactional
    public String deactivate(String id) {
        Geofence geofence = findActive(id);
        geofence.setActive(false);
        geofenceRepository.save(geofence);
        return geofence.getTenantId();
    }

    Geofence findActive(String id) {
        return geofenceRepository.findById(id)
            .filter(geofence -> !Boolean.FALSE.equals(geofence.getActive()))
            .orElseThrow(() -> new ZoneNotFoundException(id));
    }

    private StoredGeofence store(Geofence geofence, GeofenceRequest request) {
        apply(geofence, request);
        CachedGeofence cached = CachedGeofence.fromEntity(geofence);
        Geofence saved = geofenceRepository.save(geofence);
        return new StoredGeofence(GeofenceView.from(saved), cached);
    }

    private void apply(Geofence geofence, GeofenceRequest request) {
        geofence.setTenantId(request.tenantId().trim());
        geofence.setName(request.name().trim());
        geofence.setShapeType(request.shapeType());
        if (request.shapeType() == GeofenceShapeType.POLYGON) {
            geofence.setPolygonWkt(PolygonShape.fromRing(request.polygon()).toWkt());
            geofence.setCenterLat(null);
            geofence.setCenterLon(null);
            geofence.setRadiusM(null);
            geofence.setInnerRadiusM(null);
            geofence.setOuterRadiusM(null);
        } else {
            geofence.setPolygonWkt(null);
            geofence.setCenterLat(request.centerLat());
            geofence.setCenterLon(request.centerLon());
            geofence.setRadiusM(request.radiusM());
            geofence.setInnerRadiusM(request.innerRadiusM());
            geofence.setOuterRadiusM(request.outerRadiusM());
        }
        geofence.setVehicleIds(request.vehicleIds() == null ? new HashSet<>() : new HashSet<>(request.vehicleIds()));
        geofence.setShipmentIds(request.shipmentIds() == null ? new HashSet<>() : new HashSet<>(request.shipmentIds()));
        geofence.setOnEntry(request.onEntry() == null || request.onEntry());
        geofence.setOnExit(request.onExit() == null || request.onExit());
        geofence.setActive(true);
    }

    public record StoredGeofence(GeofenceView view, CachedGeofence cached) {
    }
}
