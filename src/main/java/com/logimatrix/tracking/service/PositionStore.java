package com.logimatrix.tracking.service;

import com.logimatrix.tracking.config.TrackingProperties;
import com.logimatrix.tracking.dto.FixRecord;
import com.logimatrix.tracking.entity.TrackPoint;
import com.logimatrix.tracking.repository.TrackPointRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Hot latest-position view plus the durable track history.
 *
 * Two stores because the access patterns differ:
 * - Hot cache: point writes and reads, short TTL (Redis by default)
 * - History: append-heavy with range reads (PostgreSQL, purged after the retention window)
 *
 * Only the ingestion coordinator writes, and it serializes per vehicle, so a
 * vehicle key has a single writer within one instance.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PositionStore {

    static final String VEHICLE_KEY_PREFIX = "position:vehicle:";
    static final String SHIPMENT_KEY_PREFIX = "position:shipment:";

    private final LatestPositionCache latestPositionCache;
    private final TrackPointRepository trackPointRepository;
    private final TrackingProperties properties;
    private final Clock clock;

    /**
     * Stores the fix as the latest position of its vehicle (and of its shipment
     * if set) when it is newer than the current one.
     *
     * @return false if the fix was discarded as stale
     */
    public boolean putLatest(FixRecord fix) {
        Duration ttl = properties.getPosition().getHotTtl();
        boolean stored = latestPositionCache.putIfNewer(VEHICLE_KEY_PREFIX + fix.vehicleId(), fix, ttl);
        if (!stored) {
            log.debug("Discarded stale fix: {}", fix.toLogString());
            return false;
        }
        if (fix.hasShipment()) {
            latestPositionCache.putIfNewer(SHIPMENT_KEY_PREFIX + fix.shipmentId(), fix, ttl);
        }
        return true;
    }

    /**
     * Undoes a {@link #putLatest} whose caller gave up on it. Each key still
     * holding {@code orphan} goes back to {@code previous} when that fix belongs
     * to the key, and is deleted otherwise. Keys already overwritten by a newer
     * fix are left alone.
     */
    public void revertLatest(FixRecord orphan, FixRecord previous) {
        Duration ttl = properties.getPosition().getHotTtl();
        boolean reverted = latestPositionCache.replaceIfCurrent(VEHICLE_KEY_PREFIX + orphan.vehicleId(), orphan, previous, ttl);
        if (orphan.hasShipment()) {
            FixRecord shipmentPrevious = previous != null && orphan.shipmentId().equals(previous.shipmentId()) ? previous : null;
            latestPositionCache.replaceIfCurrent(SHIPMENT_KEY_PREFIX + orphan.shipmentId(), orphan, shipmentPrevious, ttl);
        }
        if (reverted) {
            log.info("Reverted late hot write of {}", orphan.toLogString());
        }
    }

    public Optional<FixRecord> getLatest(String vehicleId) {
        return latestPositionCache.get(VEHICLE_KEY_PREFIX + vehicleId);
    }

    public Optional<FixRecord> getLatestForShipment(String shipmentId) {
        return latestPositionCache.get(SHIPMENT_KEY_PREFIX + shipmentId);
    }

    /**
     * Appends the fix to the track history. A fix already stored for the same
     * (vehicle, ts) is ignored.
     */
    public void appendHistory(FixRecord fix) {
        if (trackPointRepository.existsByVehicleIdAndTs(fix.vehicleId(), fix.ts())) {
            log.debug("Track point already stored: {}", fix.toLogString());
            return;
        }
        try {
            trackPointRepository.save(TrackPoint.fromFix(fix));
        } catch (DataIntegrityViolationException e) {
            // Lost a race against a concurrent insert of the same (vehicle, ts)
            log.debug("Duplicate track point ignored: {}", fix.toLogString());
        }
    }

    /**
     * History of a vehicle, most recent first.
     *
     * The range is clamped to the retention window; {@code limit} defaults to
     * 100 and is capped at 1000.
     */
    @Transactional(readOnly = true)
    public List<FixRecord> queryHistory(String vehicleId, Instant from, Instant to, Integer limit) {
        Window window = window(from, to);
        return trackPointRepository.findByVehicleIdAndTsBetweenOrderByTsDesc(
                vehicleId, window.from(), window.to(), PageRequest.of(0, effectiveLimit(limit)))
            .stream()
            .map(TrackPoint::toFix)
            .toList();
    }

    /**
     * Trail of a shipment across every vehicle that carried it, oldest first.
     */
    @Transactional(readOnly = true)
    public List<FixRecord> shipmentTrail(String shipmentId, Instant from, Instant to, Integer limit) {
        Window window = window(from, to);
        return trackPointRepository.findByShipmentIdAndTsBetweenOrderByTsAsc(
                shipmentId, window.from(), window.to(), PageRequest.of(0, effectiveLimit(limit)))
            .stream()
            .map(TrackPoint::toFix)
            .toList();
    }

    /**
     * Samples of a vehicle in {@code (until - window, until]}, oldest first.
     */
    @Transactional(readOnly = true)
    public List<FixRecord> recentSamples(String vehicleId, Instant until, Duration window) {
        return trackPointRepository.findByVehicleIdAndTsAfterOrderByTsAsc(vehicleId, until.minus(window))
            .stream()
            .filter(point -> !point.getTs().isAfter(until))
            .map(TrackPoint::toFix)
            .toList();
    }

    /**
     * Purges track points past the retention window and expired in-memory hot entries.
     */
    @Scheduled(fixedDelayString = "${tracking.position.purge-interval-ms:300000}",
               initialDelayString = "${tracking.position.purge-interval-ms:300000}")
    public void purgeExpired() {
        Instant cutoff = clock.instant().minus(properties.getPosition().getHistoryRetention());
        try {
            int deleted = trackPointRepository.deleteOlderThan(cutoff);
            int evicted = latestPositionCache.evictExpired();
            if (deleted > 0 || evicted > 0) {
                log.info("Purged {} track points older than {} and {} expired hot positions", deleted, cutoff, evicted);
            }
        } catch (Exception e) {
            log.error("Track history purge failed", e);
        }
    }

    private Window window(Instant from, Instant to) {
        Instant now = clock.instant();
        Instant oldest = now.minus(properties.getPosition().getHistoryRetention());
        Instant effectiveFrom = from == null || from.isBefore(oldest) ? oldest : from;
        Instant effectiveTo = to == null ? now : to;
        return new Window(effectiveFrom, effectiveTo);
    }

    private int effectiveLimit(Integer limit) {
        TrackingProperties.Position position = properties.getPosition();
        if (limit == null || limit <= 0) {
            return position.getDefaultHistoryLimit();
        }
        return Math.min(limit, position.getMaxHistoryLimit());
    }

    private record Window(Instant from, Instant to) {
    }
}
