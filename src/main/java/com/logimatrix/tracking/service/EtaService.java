package com.logimatrix.tracking.service;

import com.logimatrix.tracking.config.TrackingProperties;
import com.logimatrix.tracking.dto.EtaConfidence;
import com.logimatrix.tracking.dto.EtaEstimate;
import com.logimatrix.tracking.dto.FixRecord;
import com.logimatrix.tracking.dto.SpeedSource;
import com.logimatrix.tracking.exception.NoLocationException;
import com.logimatrix.tracking.geo.GeoPoint;
import com.logimatrix.tracking.geo.GeoUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * ETA from the latest hot position to a destination coordinate.
 *
 * Speed estimate, first that applies:
 * 1. At least 3 samples with a speed in the last 60 s of track: exponentially
 *    weighted mean (oldest first), clamped to [5, 150] km/h
 * 2. Speed of the latest fix, same clamp
 * 3. Configured default (50 km/h)
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EtaService {

    private final PositionStore positionStore;
    private final TrackingProperties properties;
    private final Clock clock;

    public EtaEstimate forVehicle(String vehicleId, double destinationLat, double destinationLon) {
        FixRecord latest = positionStore.getLatest(vehicleId)
            .orElseThrow(() -> new NoLocationException("vehicle " + vehicleId));
        return estimate(latest, destinationLat, destinationLon);
    }

    public EtaEstimate forShipment(String shipmentId, double destinationLat, double destinationLon) {
        FixRecord latest = positionStore.getLatestForShipment(shipmentId)
            .orElseThrow(() -> new NoLocationException("shipment " + shipmentId));
        return estimate(latest, destinationLat, destinationLon);
    }

    EtaEstimate estimate(FixRecord latest, double destinationLat, double destinationLon) {
        GeoPoint destination = GeoPoint.of(destinationLat, destinationLon);
        if (!destination.isValid()) {
            throw new IllegalArgumentException("Invalid destination: " + destinationLat + ", " + destinationLon);
        }
        TrackingProperties.Eta settings = properties.getEta();

        double distanceKm = GeoUtils.distanceKm(latest.lat(), latest.lon(), destinationLat, destinationLon);

        List<FixRecord> samples = positionStore.recentSamples(latest.vehicleId(), latest.ts(), settings.getSampleWindow())
            .stream()
            .filter(sample -> sample.speed() != null)
            .toList();

        double speedKmh;
        SpeedSource source;
        if (samples.size() >= settings.getMinSamples()) {
            speedKmh = clamp(weightedMean(samples, settings.getEwmaAlpha()));
            source = SpeedSource.RECENT_SAMPLES;
        } else if (latest.speed() != null) {
            speedKmh = clamp(latest.speed());
            source = SpeedSource.LAST_KNOWN;
        } else {
            speedKmh = settings.getDefaultSpeedKmh();
            source = SpeedSource.DEFAULT;
        }

        long etaSeconds = Math.round(distanceKm / speedKmh * 3600.0);
        EtaConfidence confidence = confidence(source, Duration.between(latest.ts(), clock.instant()));

        log.debug("ETA for vehicle {}: {} km at {} km/h ({}) = {}s",
            latest.vehicleId(), distanceKm, speedKmh, source, etaSeconds);

        return new EtaEstimate(
            distanceKm,
            speedKmh,
            etaSeconds,
            confidence,
            source,
            source == SpeedSource.RECENT_SAMPLES ? samples.size() : 0,
            GeoPoint.of(latest.lat(), latest.lon()),
            destination,
            latest.ts(),
            latest.ts().plusSeconds(etaSeconds)
        );
    }

    /**
     * high: enough recent samples and a position no older than the sample window.
     * medium: enough samples with an older position, or a last known speed from
     * a position still within the hot TTL.
     * low: everything else.
     */
    private EtaConfidence confidence(SpeedSource source, Duration dataAge) {
        TrackingProperties.Eta settings = properties.getEta();
        if (source == SpeedSource.RECENT_SAMPLES) {
            return dataAge.compareTo(settings.getSampleWindow()) <= 0 ? EtaConfidence.HIGH : EtaConfidence.MEDIUM;
        }
        if (source == SpeedSource.LAST_KNOWN && dataAge.compareTo(properties.getPosition().getHotTtl()) <= 0) {
            return EtaConfidence.MEDIUM;
        }
        return EtaConfidence.LOW;
    }

    static double weightedMean(List<FixRecord> samplesOldestFirst, double alpha) {
        double mean = samplesOldestFirst.get(0).speed();
        for (int i = 1; i < samplesOldestFirst.size(); i++) {
            mean = alpha * samplesOldestFirst.get(i).speed() + (1 - alpha) * mean;
        }
        return mean;
    }

    private double clamp(double speedKmh) {
        TrackingProperties.Eta settings = properties.getEta();
        return Math.max(settings.getMinSpeedKmh(), Math.min(settings.getMaxSpeedKmh(), speedKmh));
    }
}
