package com.logimatrix.tracking.service;

import com.logimatrix.tracking.config.TrackingProperties;
import com.logimatrix.tracking.dto.CachedAccidentZone;
import com.logimatrix.tracking.dto.CachedGeofence;
import com.logimatrix.tracking.entity.AccidentSeverity;
import com.logimatrix.tracking.exception.ZoneRegistryException;
import com.logimatrix.tracking.geo.CircleShape;
import com.logimatrix.tracking.geo.GeoPoint;
import com.logimatrix.tracking.geo.ZoneShape;
import com.logimatrix.tracking.support.MutableClock;
import com.uber.h3core.H3Core;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ZoneRegistryTest {

    private MutableClock clock;
    private ZoneRegistry registry;

    @BeforeEach
    void setUp() throws IOException {
        clock = new MutableClock(Instant.parse("2024-01-01T12:00:00Z"));
        registry = new ZoneRegistry(new H3CellIndexer(H3Core.newInstance(), new TrackingProperties()), clock);
    }

    @Test
    void geofenceIsCandidateOnlyForItsTenantAndNearby() {
        registry.upsertGeofence(depot("Z", "acme"));

        ZoneSnapshot snapshot = registry.snapshot();

        assertThat(snapshot.geofenceCandidates("acme", 12.972, 77.595))
            .extracting(CachedGeofence::zoneId).containsExactly("Z");
        assertThat(snapshot.geofenceCandidates("globex", 12.972, 77.595)).isEmpty();
        assertThat(snapshot.geofenceCandidates("acme", 18.5204, 73.8567)).isEmpty();
    }

    @Test
    void everyChangePublishesANewVersionAndOldSnapshotsStayIntact() {
        ZoneSnapshot before = registry.snapshot();
        registry.upsertGeofence(depot("Z", "acme"));
        ZoneSnapshot withZone = registry.snapshot();

        assertThat(registry.removeGeofence("Z")).isTrue();
        assertThat(registry.removeGeofence("Z")).isFalse();

        assertThat(withZone.version()).isGreaterThan(before.version());
        assertThat(registry.snapshot().version()).isGreaterThan(withZone.version());
        assertThat(withZone.geofence("Z")).isPresent();
        assertThat(registry.snapshot().geofence("Z")).isEmpty();
        assertThat(registry.snapshot().geofenceCandidates("acme", 12.972, 77.595)).isEmpty();
    }

    @Test
    void upsertMovesAZoneToItsNewCells() {
        registry.upsertGeofence(depot("Z", "acme"));
        registry.upsertGeofence(new CachedGeofence("Z", "acme", "Moved depot",
            CircleShape.of(18.5204, 73.8567, 500), null, null, true, true));

        ZoneSnapshot snapshot = registry.snapshot();

        assertThat(snapshot.geofenceCount()).isEqualTo(1);
        assertThat(snapshot.geofenceCandidates("acme", 12.972, 77.595)).isEmpty();
        assertThat(snapshot.geofenceCandidates("acme", 18.5204, 73.8567))
            .extracting(CachedGeofence::name).containsExactly("Moved depot");
    }

    @Test
    void failedUpdateKeepsThePreviousSnapshot() {
        registry.upsertGeofence(depot("Z", "acme"));
        ZoneSnapshot good = registry.snapshot();

        CachedGeofence broken = new CachedGeofence("B", "acme", "Broken", new BrokenShape(), null, null, true, true);

        assertThatThrownBy(() -> registry.upsertGeofence(broken)).isInstanceOf(ZoneRegistryException.class);
        assertThat(registry.snapshot()).isSameAs(good);
        assertThat(registry.snapshot().geofence("B")).isEmpty();
    }

    @Test
    void oversizedZoneIsCheckedOnEveryLookup() {
        registry.upsertGeofence(new CachedGeofence("STATE", "acme", "Karnataka",
            CircleShape.of(12.9716, 77.5946, 400_000), null, null, true, true));

        ZoneSnapshot snapshot = registry.snapshot();

        assertThat(snapshot.oversizedZoneCount()).isEqualTo(1);
        assertThat(snapshot.geofenceCandidates("acme", 15.0, 75.0))
            .extracting(CachedGeofence::zoneId).containsExactly("STATE");

        registry.removeGeofence("STATE");
        assertThat(registry.snapshot().oversizedZoneCount()).isZero();
    }

    @Test
    void accidentSetIsStaleUntilLoadedAndAfterMaxAge() {
        Duration maxAge = Duration.ofHours(2);
        assertThat(registry.snapshot().isAccidentSetStale(clock.instant(), maxAge)).isTrue();

        registry.replaceAccidentZones(List.of(shivajinagar()));

        assertThat(registry.snapshot().isAccidentSetStale(clock.instant(), maxAge)).isFalse();
        clock.advance(Duration.ofHours(3));
        assertThat(registry.snapshot().isAccidentSetStale(clock.instant(), maxAge)).isTrue();
    }

    @Test
    void accidentZonesWithinAreSortedNearestFirst() {
        registry.replaceAccidentZones(List.of(
            shivajinagar(),
            new CachedAccidentZone("B", "Deccan", new GeoPoint(18.5167, 73.8415), AccidentSeverity.LOW, 3, 250)
        ));

        List<CachedAccidentZone> nearby = registry.snapshot().accidentZonesWithin(18.5170, 73.8420, 5_000);

        assertThat(nearby).extracting(CachedAccidentZone::zoneId).containsExactly("B", "A");
        assertThat(registry.snapshot().accidentZonesWithin(12.9716, 77.5946, 5_000)).isEmpty();
        assertThat(registry.snapshot().accidentCandidates(18.5210, 73.8570))
            .extracting(CachedAccidentZone::zoneId).contains("A");
    }

    @Test
    void statsReflectTheCurrentSnapshot() {
        registry.upsertGeofence(depot("Z", "acme"));
        registry.replaceAccidentZones(List.of(shivajinagar()));

        ZoneRegistry.RegistryStats stats = registry.stats();

        assertThat(stats.geofenceCount()).isEqualTo(1);
        assertThat(stats.accidentZoneCount()).isEqualTo(1);
        assertThat(stats.accidentZonesLoadedAt()).isEqualTo(clock.instant());
        assertThat(stats.h3Resolution()).isEqualTo(6);
    }

    private static CachedGeofence depot(String id, String tenantId) {
        return new CachedGeofence(id, tenantId, "Depot", CircleShape.of(12.9716, 77.5946, 500), null, null, true, true);
    }

    private static CachedAccidentZone shivajinagar() {
        return new CachedAccidentZone("A", "Shivajinagar", new GeoPoint(18.5204, 73.8567), AccidentSeverity.HIGH, 12, 300);
    }

    private static final class BrokenShape implements ZoneShape {

        @Override
        public boolean contains(double lat, double lon) {
            return false;
        }

        @Override
        public GeoPoint boundingCenter() {
            throw new IllegalStateException("geometry not loaded");
        }

        @Override
        public double boundingRadiusMeters() {
            return 100;
        }
    }
}
