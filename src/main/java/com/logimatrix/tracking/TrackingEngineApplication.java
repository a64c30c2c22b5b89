package com.logimatrix.tracking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main entry point for the Real-Time Tracking & Spatial Alert Engine.
 *
 * Flow:
 * 1. Fixes arrive via REST or STOMP
 * 2. The ingestion coordinator validates them and serializes per vehicle
 * 3. The latest position and the track history are written
 * 4. Geofence and accident-proximity engines evaluate the fix against the zone registry
 * 5. Location updates and alerts are published to subscribers and alerts are logged
 *
 * Caching, scheduling and async executors are enabled in their own
 * configuration classes (RedisConfig, AsyncConfig).
 */
@SpringBootApplication
public class TrackingEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrackingEngineApplication.class, args);
    }
}
