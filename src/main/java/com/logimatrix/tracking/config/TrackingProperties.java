package com.logimatrix.tracking.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

import com.logimatrix.tracking.entity.AccidentSeverity;

/**
 * All tunables of the tracking engine, bound from {@code tracking.*}.
 *
 * Defaults match the production profile; application.yml only overrides what
 * differs per environment.
 */
@Data
@ConfigurationProperties(prefix = "tracking")
public class TrackingProperties {

    private Position position = new Position();
    private Ingest ingest = new Ingest();
    private Fleet fleet = new Fleet();
    private Geofence geofence = new Geofence();
    private Accident accident = new Accident();
    private Registry registry = new Registry();
    private Bus bus = new Bus();
    private Eta eta = new Eta();
    private Alerts alerts = new Alerts();
    private Telemetry telemetry = new Telemetry();

    @Data
    public static class Position {
        /** Hot cache backend: redis or memory. */
        private String cache = "redis";
        /** TTL of the hot latest-fix entries. */
        private Duration hotTtl = Duration.ofMinutes(5);
        /** Age after which track points are purged and hidden from queries. */
        private Duration historyRetention = Duration.ofHours(24);
        private int defaultHistoryLimit = 100;
        private int maxHistoryLimit = 1000;
    }

    @Data
    public static class Ingest {
        private Duration maxFutureSkew = Duration.ofSeconds(30);
        private Duration maxAge = Duration.ofMinutes(10);
        /** Per-vehicle queue depth; the oldest queued fix is dropped beyond it. */
        private int queueCapacity = 64;
        private int workerPoolSize = 8;
        /** Fixes one lane processes before yielding its worker. */
        private int drainBatchSize = 32;
        private Duration storeWriteTimeout = Duration.ofMillis(200);
        private Duration logWriteTimeout = Duration.ofMillis(500);
        /** How long a synchronous producer waits for its ingestion result. */
        private Duration responseTimeout = Duration.ofSeconds(2);
        /** Idle time after which a vehicle's in-memory state is evicted. */
        private Duration contextIdle = Duration.ofMinutes(30);
    }

    @Data
    public static class Fleet {
        /** Vehicle validation: jpa (fleet_vehicles table) or permissive. */
        private String directory = "jpa";
    }

    @Data
    public static class Geofence {
        /** Fixes with a worse reported accuracy do not change membership. */
        private double accuracyCeilingMeters = 150.0;
    }

    @Data
    public static class Accident {
        private Duration exitHold = Duration.ofSeconds(60);
        private Duration activeMax = Duration.ofMinutes(15);
        /** Distances closer than this are ties, broken by severity. */
        private double tieToleranceMeters = 1.0;
        /** Proximity evaluation is skipped when accident zones were loaded longer ago. */
        private Duration maxSnapshotAge = Duration.ofHours(2);
        private Map<AccidentSeverity, Double> radiusBySeverity = defaultRadii();

        private static Map<AccidentSeverity, Double> defaultRadii() {
            Map<AccidentSeverity, Double> radii = new EnumMap<>(AccidentSeverity.class);
            radii.put(AccidentSeverity.LOW, 250.0);
            radii.put(AccidentSeverity.MEDIUM, 500.0);
            radii.put(AccidentSeverity.HIGH, 1000.0);
            return radii;
        }

        public double radiusFor(AccidentSeverity severity) {
            Double radius = radiusBySeverity.get(severity);
            return radius != null ? radius : 500.0;
        }
    }

    @Data
    public static class Registry {
        /** Reload interval of geofences and accident zones from the database. */
        private Duration refreshInterval = Duration.ofMinutes(30);
        /** H3 resolution of the coarse zone index (6 is roughly 3.7 km edges). */
        private int h3Resolution = 6;
        /** Zones needing a wider k-ring than this are checked on every lookup. */
        private int maxIndexRing = 48;
    }

    @Data
    public static class Bus {
        private int subscriberBufferSize = 256;
        private Duration publishTimeout = Duration.ofMillis(100);
    }

    @Data
    public static class Eta {
        private Duration sampleWindow = Duration.ofSeconds(60);
        private int minSamples = 3;
        private double ewmaAlpha = 0.3;
        private double minSpeedKmh = 5.0;
        private double maxSpeedKmh = 150.0;
        private double defaultSpeedKmh = 50.0;
    }

    @Data
    public static class Alerts {
        private Duration retention = Duration.ofDays(90);
        private int maxWriteAttempts = 5;
        private int defaultPageSize = 50;
        private int maxPageSize = 500;
    }

    @Data
    public static class Telemetry {
        private double lowFuelPct = 15.0;
        private double overheatC = 100.0;
        private double lowBatteryV = 11.5;
        /** Optional tire-pressure band in psi; a bound left null is not checked. */
        private Double tirePressureMin;
        private Double tirePressureMax;
        /** Optional oil-pressure floor in psi. */
        private Double oilPressureMin;
        private Duration historyRetention = Duration.ofDays(7);
        private int defaultHistoryLimit = 100;
        private int maxHistoryLimit = 1000;
    }
}
