package com.logimatrix.tracking.repository;

import com.logimatrix.tracking.dto.AlertQuery;
import com.logimatrix.tracking.entity.AccidentSeverity;
import com.logimatrix.tracking.entity.AlertStatus;
import com.logimatrix.tracking.entity.AlertType;
import com.logimatrix.tracking.entity.TrackingAlert;
import com.logimatrix.tracking.service.AlertLogWriter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(AlertLogWriter.class)
class TrackingAlertRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-01-01T12:00:00Z");

    @Autowired
    private TrackingAlertRepository repository;

    @Autowired
    private AlertLogWriter writer;

    @Test
    void secondInsertWithSameKeyIsIgnored() {
        assertThat(writer.insertIfAbsent(proximity("V", "A", T0, AccidentSeverity.HIGH))).isTrue();
        assertThat(writer.insertIfAbsent(proximity("V", "A", T0, AccidentSeverity.HIGH))).isFalse();

        assertThat(repository.count()).isEqualTo(1);
        assertThat(repository.findByIdempotencyKey("V:A:" + T0.toEpochMilli()))
            .hasValueSatisfying(alert -> assertThat(alert.getMetadata()).containsEntry("message", "careful"));
    }

    @Test
    void newProximityAlertResolvesTheOpenOneOfTheSamePair() {
        writer.insertIfAbsent(proximity("V", "A", T0, AccidentSeverity.HIGH));
        writer.insertIfAbsent(proximity("V", "A", T0.plusSeconds(600), AccidentSeverity.HIGH));
        writer.insertIfAbsent(proximity("V", "B", T0.plusSeconds(600), AccidentSeverity.LOW));

        List<TrackingAlert> openForA = repository.findByVehicleIdAndZoneIdAndAlertTypeAndStatusIn(
            "V", "A", AlertType.ACCIDENT_PROXIMITY, List.of(AlertStatus.ACTIVE, AlertStatus.ACKNOWLEDGED));
        assertThat(openForA).singleElement()
            .satisfies(alert -> assertThat(alert.getTs()).isEqualTo(T0.plusSeconds(600)));

        TrackingAlert superseded = repository.findByIdempotencyKey("V:A:" + T0.toEpochMilli()).orElseThrow();
        assertThat(superseded.getStatus()).isEqualTo(AlertStatus.RESOLVED);
        assertThat(superseded.getResolvedAt()).isEqualTo(T0.plusSeconds(600));

        assertThat(repository.findByVehicleIdAndAlertTypeAndStatusIn(
            "V", AlertType.ACCIDENT_PROXIMITY, List.of(AlertStatus.ACTIVE))).hasSize(2);
    }

    @Test
    void resolveByKeyClosesTheAlertOnce() {
        writer.insertIfAbsent(proximity("V", "A", T0, AccidentSeverity.MEDIUM));
        String key = "V:A:" + T0.toEpochMilli();

        assertThat(writer.resolveByKey(key, T0.plusSeconds(70))).isTrue();
        assertThat(writer.resolveByKey(key, T0.plusSeconds(900))).isTrue();
        assertThat(writer.resolveByKey("V:A:1", T0)).isFalse();

        TrackingAlert alert = repository.findByIdempotencyKey(key).orElseThrow();
        assertThat(alert.getStatus()).isEqualTo(AlertStatus.RESOLVED);
        assertThat(alert.getResolvedAt()).isEqualTo(T0.plusSeconds(70));
    }

    @Test
    void acknowledgeOnlyMovesActiveAlerts() {
        TrackingAlert alert = proximity("V", "A", T0, AccidentSeverity.HIGH);
        writer.insertIfAbsent(alert);

        TrackingAlert acknowledged = writer.acknowledge(alert.getId(), "ops-1", T0.plusSeconds(5));
        assertThat(acknowledged.getStatus()).isEqualTo(AlertStatus.ACKNOWLEDGED);
        assertThat(acknowledged.getAcknowledgedBy()).isEqualTo("ops-1");

        TrackingAlert resolved = writer.resolve(alert.getId(), T0.plusSeconds(9));
        assertThat(writer.acknowledge(alert.getId(), "ops-2", T0.plusSeconds(10)).getStatus())
            .isEqualTo(AlertStatus.RESOLVED);
        assertThat(resolved.getAcknowledgedBy()).isEqualTo("ops-1");
    }

    @Test
    void specificationsCombineOptionalFilters() {
        writer.insertIfAbsent(proximity("V", "A", T0, AccidentSeverity.HIGH));
        writer.insertIfAbsent(proximity("V", "B", T0.plusSeconds(60), AccidentSeverity.LOW));
        writer.insertIfAbsent(proximity("W", "A", T0.plusSeconds(120), AccidentSeverity.HIGH));
        writer.insertIfAbsent(geofence("V", "Z", T0.plusSeconds(180)));

        AlertQuery highOfV = new AlertQuery(null, "V", null, AccidentSeverity.HIGH, null, null, null, null);
        assertThat(repository.findAll(TrackingAlertSpecifications.matching(highOfV)))
            .extracting(TrackingAlert::getZoneId).containsExactly("A");

        AlertQuery geofences = new AlertQuery("acme", null, null, null, AlertType.GEOFENCE, null, null, null);
        assertThat(repository.findAll(TrackingAlertSpecifications.matching(geofences)))
            .extracting(TrackingAlert::getZoneId).containsExactly("Z");

        AlertQuery window = new AlertQuery(null, null, null, null, null, null, T0.plusSeconds(60), T0.plusSeconds(120));
        assertThat(repository.findAll(TrackingAlertSpecifications.matching(window),
                PageRequest.of(0, 10, Sort.by(Sort.Direction.DESC, "emittedAt"))).getContent())
            .extracting(TrackingAlert::getVehicleId).containsExactly("W", "V");

        assertThat(repository.findAll(TrackingAlertSpecifications.matching(AlertQuery.forVehicle("V")))).hasSize(3);
    }

    @Test
    void vehicleStatisticsGroupBySeverityAndZone() {
        writer.insertIfAbsent(proximity("V", "A", T0, AccidentSeverity.HIGH));
        writer.insertIfAbsent(proximity("V", "A", T0.plusSeconds(600), AccidentSeverity.HIGH));
        writer.insertIfAbsent(proximity("V", "B", T0.plusSeconds(60), AccidentSeverity.LOW));
        writer.insertIfAbsent(geofence("V", "Z", T0.plusSeconds(180)));
        writer.insertIfAbsent(proximity("V", "C", T0.minusSeconds(7200), AccidentSeverity.LOW));

        Instant since = T0.minusSeconds(60);
        assertThat(repository.countByVehicleIdAndEmittedAtGreaterThanEqual("V", since)).isEqualTo(4);

        Map<AccidentSeverity, Long> bySeverity = new HashMap<>();
        for (Object[] row : repository.countBySeverityForVehicle("V", since)) {
            bySeverity.put((AccidentSeverity) row[0], ((Number) row[1]).longValue());
        }
        assertThat(bySeverity).containsEntry(AccidentSeverity.HIGH, 2L)
            .containsEntry(AccidentSeverity.LOW, 1L)
            .containsEntry(null, 1L);

        List<Object[]> topZones = repository.topZonesForVehicle("V", since, PageRequest.of(0, 5));
        assertThat(topZones.get(0)[0]).isEqualTo("A");
        assertThat(((Number) topZones.get(0)[2]).longValue()).isEqualTo(2L);
    }

    @Test
    void purgeBatchSelectsOnlyExpiredAlerts() {
        writer.insertIfAbsent(proximity("V", "A", T0.minusSeconds(86_400L * 100), AccidentSeverity.HIGH));
        writer.insertIfAbsent(proximity("V", "B", T0, AccidentSeverity.HIGH));

        assertThat(repository.findTop500ByEmittedAtBefore(T0.minusSeconds(86_400L * 90)))
            .extracting(TrackingAlert::getZoneId).containsExactly("A");
    }

    private static TrackingAlert proximity(String vehicleId, String zoneId, Instant ts, AccidentSeverity severity) {
        Map<String, String> metadata = new HashMap<>();
        metadata.put("message", "careful");
        return TrackingAlert.builder()
            .alertType(AlertType.ACCIDENT_PROXIMITY)
            .tenantId("acme")
            .vehicleId(vehicleId)
            .zoneId(zoneId)
            .zoneName("Zone " + zoneId)
            .severity(severity)
            .accidentCount(12)
            .distanceM(74.0)
            .vehicleLat(18.521)
            .vehicleLon(73.857)
            .ts(ts)
            .emittedAt(ts)
            .idempotencyKey(vehicleId + ":" + zoneId + ":" + ts.toEpochMilli())
            .metadata(metadata)
            .build();
    }

    private static TrackingAlert geofence(String vehicleId, String zoneId, Instant ts) {
        return TrackingAlert.builder()
            .alertType(AlertType.GEOFENCE)
            .tenantId("acme")
            .vehicleId(vehicleId)
            .zoneId(zoneId)
            .zoneName("Depot")
            .kind("entry")
            .vehicleLat(12.972)
            .vehicleLon(77.595)
            .ts(ts)
            .emittedAt(ts)
            .idempotencyKey(vehicleId + ":" + zoneId + ":" + ts.toEpochMilli() + ":entry")
            .build();
    }
}
