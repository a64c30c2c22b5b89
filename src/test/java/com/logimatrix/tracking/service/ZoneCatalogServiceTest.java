package com.logimatrix.tracking.service;

import com.logimatrix.tracking.config.TrackingProperties;
import com.logimatrix.tracking.dto.CachedGeofence;
import com.logimatrix.tracking.dto.GeofenceRequest;
import com.logimatrix.tracking.dto.GeofenceView;
import com.logimatrix.tracking.entity.GeofenceShapeType;
import com.logimatrix.tracking.geo.CircleShape;
import com.logimatrix.tracking.geo.GeoPoint;
import com.logimatrix.tracking.repository.AccidentZoneRepository;
import com.logimatrix.tracking.repository.GeofenceRepository;
import com.logimatrix.tracking.support.MutableClock;
import com.uber.h3core.H3Core;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ZoneCatalogServiceTest {

    private static final Instant T0 = Instant.parse("2024-01-01T12:00:00Z");

    private GeofenceWriter geofenceWriter;
    private ZoneRegistry registry;
    private ZoneCatalogService catalog;

    @BeforeEach
    void setUp() throws IOException {
        TrackingProperties properties = new TrackingProperties();
        geofenceWriter = mock(GeofenceWriter.class);
        registry = new ZoneRegistry(new H3CellIndexer(H3Core.newInstance(), properties), new MutableClock(T0));
        catalog = new ZoneCatalogService(mock(GeofenceRepository.class), geofenceWriter,
            mock(AccidentZoneRepository.class), registry, properties);
    }

    @Test
    void createdGeofenceIsIndexed() {
        when(geofenceWriter.create(any(GeofenceRequest.class)))
            .thenReturn(new GeofenceWriter.StoredGeofence(view("Z"), cached("Z")));

        catalog.createGeofence(request());

        assertThat(registry.snapshot().geofence("Z")).isPresent();
    }

    @Test
    void geofenceCreatedDuringARefreshSurvivesIt() throws Exception {
        when(geofenceWriter.create(any(GeofenceRequest.class)))
            .thenReturn(new GeofenceWriter.StoredGeofence(view("NEW"), cached("NEW")));
        AtomicReference<Thread> creator = new AtomicReference<>();
        when(geofenceWriter.loadActive()).thenAnswer(invocation -> {
            Thread thread = new Thread(() -> catalog.createGeofence(request()));
            creator.set(thread);
            thread.start();
            waitUntilBlocked(thread);
            return List.of(cached("OLD"));
        });

        catalog.refreshGeofences();
        creator.get().join(5000);

        assertThat(creator.get().isAlive()).isFalse();
        assertThat(registry.snapshot().geofence("OLD")).isPresent();
        assertThat(registry.snapshot().geofence("NEW")).isPresent();
    }

    @Test
    void deletedGeofenceIsForgotten() {
        registry.upsertGeofence(cached("Z"));
        when(geofenceWriter.deactivate("Z")).thenReturn("acme");

        catalog.deleteGeofence("Z");

        assertThat(registry.snapshot().geofence("Z")).isEmpty();
    }

    private static void waitUntilBlocked(Thread thread) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (thread.getState() != Thread.State.BLOCKED && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertThat(thread.getState()).isEqualTo(Thread.State.BLOCKED);
    }

    private static GeofenceRequest request() {
        return new GeofenceRequest("acme", "Depot", GeofenceShapeType.CIRCLE, 12.9716, 77.5946, 500.0,
            null, null, null, null, null, null, null);
    }

    private static CachedGeofence cached(String id) {
        return new CachedGeofence(id, "acme", "Depot " + id, CircleShape.of(12.9716, 77.5946, 500), null, null, true, true);
    }

    private static GeofenceView view(String id) {
        return new GeofenceView(id, "acme", "Depot " + id, GeofenceShapeType.CIRCLE, new GeoPoint(12.9716, 77.5946),
            500.0, null, null, null, Set.of(), Set.of(), true, true, true, T0, T0);
    }
}
