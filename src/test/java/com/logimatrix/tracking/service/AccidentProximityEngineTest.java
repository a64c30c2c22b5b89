package com.logimatrix.tracking.service;

import com.logimatrix.tracking.config.TrackingProperties;
import com.logimatrix.tracking.dto.CachedAccidentZone;
import com.logimatrix.tracking.dto.FixRecord;
import com.logimatrix.tracking.dto.ProximityActivation;
import com.logimatrix.tracking.dto.ProximityEvaluation;
import com.logimatrix.tracking.dto.ProximityResolution;
import com.logimatrix.tracking.entity.AccidentSeverity;
import com.logimatrix.tracking.geo.GeoPoint;
import com.logimatrix.tracking.support.MutableClock;
import com.uber.h3core.H3Core;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AccidentProximityEngineTest {

    private static final Instant T0 = Instant.parse("2024-01-01T12:00:00Z");

    private MutableClock clock;
    private ZoneRegistry registry;
    private AccidentProximityEngine engine;
    private SimpleMeterRegistry meterRegistry;
    private ProximityStates states;

    @BeforeEach
    void setUp() throws IOException {
        TrackingProperties properties = new TrackingProperties();
        clock = new MutableClock(T0);
        meterRegistry = new SimpleMeterRegistry();
        registry = new ZoneRegistry(new H3CellIndexer(H3Core.newInstance(), properties), clock);
        engine = new AccidentProximityEngine(properties, meterRegistry, clock);
        states = new ProximityStates();
    }

    @Test
    void activatesOnceThenReturnsToIdleAfterTheExitHold() {
        registry.replaceAccidentZones(List.of(shivajinagar()));

        ProximityEvaluation entry = evaluate(fix(18.5210, 73.8570, 10));

        assertThat(entry.activation()).isNotNull();
        assertThat(entry.activation().zoneId()).isEqualTo("A");
        assertThat(entry.activation().severity()).isEqualTo(AccidentSeverity.HIGH);
        assertThat(entry.activation().distanceM()).isCloseTo(73.8, within(1.0));
        assertThat(entry.activation().driverMessage())
            .isEqualTo("Caution: high-risk accident zone 74m ahead. 12 accidents reported here.");

        List<ProximityActivation> activations = new ArrayList<>();
        List<ProximityResolution> resolutions = new ArrayList<>();
        for (int t = 11; t <= 72; t++) {
            ProximityEvaluation evaluation = evaluate(fix(18.5400, 73.8900, t));
            activations.addAll(evaluation.activations());
            resolutions.addAll(evaluation.resolutions());
        }

        assertThat(activations).isEmpty();
        assertThat(resolutions).hasSize(1);
        ProximityResolution resolution = resolutions.get(0);
        assertThat(resolution.zoneId()).isEqualTo("A");
        assertThat(resolution.reason()).isEqualTo(ProximityResolution.EXIT_HOLD);
        assertThat(resolution.activatedAt()).isEqualTo(T0.plusSeconds(10));
        assertThat(resolution.resolvedTs()).isEqualTo(T0.plusSeconds(70));
        assertThat(states.isActive("A")).isFalse();

        ProximityEvaluation reentry = evaluate(fix(18.5210, 73.8570, 73));
        assertThat(reentry.activations()).hasSize(1);
    }

    @Test
    void staysActiveWithoutRepeatingWhileInsideTheRadius() {
        registry.replaceAccidentZones(List.of(shivajinagar()));

        int alerts = 0;
        for (int t = 0; t < 120; t += 5) {
            alerts += evaluate(fix(18.5210, 73.8570, t)).activations().size();
        }

        assertThat(alerts).isEqualTo(1);
        assertThat(states.isActive("A")).isTrue();
    }

    @Test
    void briefExcursionShorterThanTheHoldKeepsTheStateActive() {
        registry.replaceAccidentZones(List.of(shivajinagar()));
        evaluate(fix(18.5210, 73.8570, 0));

        ProximityEvaluation outside = evaluate(fix(18.5400, 73.8900, 30));
        ProximityEvaluation back = evaluate(fix(18.5210, 73.8570, 50));
        ProximityEvaluation outAgain = evaluate(fix(18.5400, 73.8900, 100));

        assertThat(outside.resolutions()).isEmpty();
        assertThat(back.activations()).isEmpty();
        assertThat(outAgain.resolutions()).isEmpty();
        assertThat(states.isActive("A")).isTrue();
    }

    @Test
    void activeMaxForcesResolutionForAParkedVehicle() {
        registry.replaceAccidentZones(List.of(shivajinagar()));
        evaluate(fix(18.5210, 73.8570, 0));

        ProximityEvaluation atLimit = evaluate(fix(18.5210, 73.8570, (int) Duration.ofMinutes(15).toSeconds()));

        assertThat(atLimit.resolutions()).extracting(ProximityResolution::reason)
            .containsExactly(ProximityResolution.ACTIVE_MAX);
        assertThat(atLimit.activations()).isEmpty();

        ProximityEvaluation next = evaluate(fix(18.5210, 73.8570, (int) Duration.ofMinutes(15).toSeconds() + 1));
        assertThat(next.activations()).hasSize(1);
    }

    @Test
    void nearestZoneWinsAndTiesGoToTheHigherSeverity() {
        GeoPoint center = new GeoPoint(18.5204, 73.8567);
        registry.replaceAccidentZones(List.of(
            new CachedAccidentZone("LOW", "Junction", center, AccidentSeverity.LOW, 40, 300),
            new CachedAccidentZone("HIGH", "Flyover", center, AccidentSeverity.HIGH, 2, 300),
            new CachedAccidentZone("FAR", "Bridge", new GeoPoint(18.5230, 73.8567), AccidentSeverity.HIGH, 90, 600)
        ));

        ProximityEvaluation evaluation = evaluate(fix(18.5205, 73.8567, 0));

        assertThat(evaluation.activation().zoneId()).isEqualTo("HIGH");
    }

    @Test
    void skipsEvaluationWhileTheZoneSetIsStale() {
        ProximityEvaluation neverLoaded = evaluate(fix(18.5210, 73.8570, 0));

        registry.replaceAccidentZones(List.of(shivajinagar()));
        clock.advance(Duration.ofHours(3));
        ProximityEvaluation stale = evaluate(fix(18.5210, 73.8570, 1));

        assertThat(neverLoaded.skipped()).isTrue();
        assertThat(stale.skipped()).isTrue();
        assertThat(stale.activations()).isEmpty();
        assertThat(meterRegistry.counter("tracking.accident.skipped.stale-registry").count()).isEqualTo(2.0);
    }

    @Test
    void restoredStateSuppressesADuplicateAlertAfterRestart() {
        registry.replaceAccidentZones(List.of(shivajinagar()));
        states.restore("A", T0);

        ProximityEvaluation evaluation = evaluate(fix(18.5210, 73.8570, 5));

        assertThat(evaluation.activations()).isEmpty();
        assertThat(states.get("A")).hasValueSatisfying(state ->
            assertThat(state.lastInsideTs()).isEqualTo(T0.plusSeconds(5)));
    }

    private ProximityEvaluation evaluate(FixRecord fix) {
        return engine.evaluate(fix, registry.snapshot(), states);
    }

    private static FixRecord fix(double lat, double lon, int second) {
        return FixRecord.of("acme", "V", lat, lon, T0.plusSeconds(second));
    }

    private static CachedAccidentZone shivajinagar() {
        return new CachedAccidentZone("A", "Shivajinagar", new GeoPoint(18.5204, 73.8567), AccidentSeverity.HIGH, 12, 300);
    }
}
