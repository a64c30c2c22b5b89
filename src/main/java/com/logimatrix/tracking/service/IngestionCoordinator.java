package com.logimatrix.tracking.service;

import com.logimatrix.tracking.bus.SubscriptionBus;
import com.logimatrix.tracking.bus.Topics;
import com.logimatrix.tracking.config.TrackingProperties;
import com.logimatrix.tracking.dto.AccidentProximityAlertEvent;
import com.logimatrix.tracking.dto.CachedAccidentZone;
import com.logimatrix.tracking.dto.FixRecord;
import com.logimatrix.tracking.dto.GeofenceAlertEvent;
import com.logimatrix.tracking.dto.GeofenceEdge;
import com.logimatrix.tracking.dto.GeofenceEvaluation;
import com.logimatrix.tracking.dto.IngestionResult;
import com.logimatrix.tracking.dto.LocationUpdateEvent;
import com.logimatrix.tracking.dto.ProximityActivation;
import com.logimatrix.tracking.dto.ProximityEvaluation;
import com.logimatrix.tracking.dto.ProximityResolution;
import com.logimatrix.tracking.entity.TrackingAlert;
import com.logimatrix.tracking.exception.DeadlineExceededException;
import com.logimatrix.tracking.exception.FixValidationException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Ingestion Coordinator: the single end-to-end path of an incoming fix.
 *
 * Processing Pipeline:
 * 1. Validate the fix and check the vehicle against the fleet directory
 * 2. Queue it on the vehicle's lane (bounded, oldest dropped when full)
 * 3. Store it as the latest position; a stale fix stops here
 * 4. Append it to the track history (best effort, not awaited)
 * 5. Run the geofence and accident-proximity engines in parallel
 * 6. Publish location_update, then geofence alerts, then proximity alerts
 * 7. Log alerts and proximity resolutions
 *
 * Steps 3 to 7 run for one fix of a vehicle at a time: a lane is drained by at
 * most one worker, so a vehicle's fixes never interleave. Different vehicles
 * proceed in parallel on the ingestion pool.
 */
@Service
@Slf4j
public class IngestionCoordinator {

    private final PositionStore positionStore;
    private final ZoneRegistry zoneRegistry;
    private final GeofenceEngine geofenceEngine;
    private final AccidentProximityEngine accidentProximityEngine;
    private final SubscriptionBus subscriptionBus;
    private final AlertLogService alertLogService;
    private final FleetDirectory fleetDirectory;
    private final BoundedIo boundedIo;
    private final TrackingProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Executor ingestionExecutor;
    private final Executor evaluationExecutor;

    private final Map<String, VehicleLane> lanes = new ConcurrentHashMap<>();
    private final Counter acceptedCounter;
    private final Counter staleCounter;
    private final Counter droppedCounter;
    private final Counter historyFailedCounter;
    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong stale = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    public IngestionCoordinator(PositionStore positionStore,
                                ZoneRegistry zoneRegistry,
                                GeofenceEngine geofenceEngine,
                                AccidentProximityEngine accidentProximityEngine,
                                SubscriptionBus subscriptionBus,
                                AlertLogService alertLogService,
                                FleetDirectory fleetDirectory,
                                BoundedIo boundedIo,
                                TrackingProperties properties,
                                MeterRegistry meterRegistry,
                                Clock clock,
                                @Qualifier("ingestionExecutor") Executor ingestionExecutor,
                                @Qualifier("evaluationExecutor") Executor evaluationExecutor) {
        this.positionStore = positionStore;
        this.zoneRegistry = zoneRegistry;
        this.geofenceEngine = geofenceEngine;
        this.accidentProximityEngine = accidentProximityEngine;
        this.subscriptionBus = subscriptionBus;
        this.alertLogService = alertLogService;
        this.fleetDirectory = fleetDirectory;
        this.boundedIo = boundedIo;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.ingestionExecutor = ingestionExecutor;
        this.evaluationExecutor = evaluationExecutor;
        this.acceptedCounter = meterRegistry.counter("tracking.fix.accepted");
        this.staleCounter = meterRegistry.counter("tracking.fix.stale");
        this.droppedCounter = meterRegistry.counter("tracking.fix.dropped.backpressure");
        this.historyFailedCounter = meterRegistry.counter("tracking.history.append.failed");
    }

    /**
     * Validates the fix and queues it on its vehicle's lane.
     *
     * The returned future completes with the outcome once the fix was
     * processed, dropped or rejected; it never completes exceptionally.
     */
    public CompletableFuture<IngestionResult> submit(FixRecord fix) {
        try {
            validate(fix);
        } catch (FixValidationException e) {
            return CompletableFuture.completedFuture(reject(fix, e.getErrorCode(), e.getMessage()));
        }

        try {
            if (!fleetDirectory.isKnownVehicle(fix.tenantId(), fix.vehicleId())) {
                return CompletableFuture.completedFuture(reject(fix, IngestionResult.UNKNOWN_VEHICLE,
                    "vehicle " + fix.vehicleId() + " is not registered for tenant " + fix.tenantId()));
            }
        } catch (RuntimeException e) {
            log.error("Fleet directory lookup failed for {}", fix.toLogString(), e);
            return CompletableFuture.completedFuture(reject(fix, IngestionResult.STORE_UNAVAILABLE, e.getMessage()));
        }

        VehicleLane.PendingFix pending = new VehicleLane.PendingFix(fix, new CompletableFuture<>());
        enqueue(pending);
        return pending.result();
    }

    /**
     * Submits fixes in order; fixes of the same vehicle keep their relative order.
     */
    public List<CompletableFuture<IngestionResult>> submitAll(List<FixRecord> fixes) {
        List<CompletableFuture<IngestionResult>> results = new ArrayList<>(fixes.size());
        for (FixRecord fix : fixes) {
            results.add(submit(fix));
        }
        return results;
    }

    /**
     * Waits for an ingestion outcome at most {@code tracking.ingest.response-timeout}.
     * The fix keeps being processed after a timeout.
     */
    public IngestionResult await(FixRecord fix, CompletableFuture<IngestionResult> future) {
        Duration timeout = properties.getIngest().getResponseTimeout();
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("No ingestion outcome within {}ms for {}", timeout.toMillis(), fix.toLogString());
            return IngestionResult.rejected(fix, IngestionResult.RESPONSE_TIMEOUT);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return IngestionResult.rejected(fix, IngestionResult.RESPONSE_TIMEOUT);
        } catch (ExecutionException e) {
            log.error("Ingestion failed for {}", fix.toLogString(), e.getCause());
            return IngestionResult.rejected(fix, IngestionResult.INTERNAL_ERROR);
        }
    }

    public IngestionResult ingest(FixRecord fix) {
        return await(fix, submit(fix));
    }

    // ==================== Lanes ====================

    private void enqueue(VehicleLane.PendingFix pending) {
        String vehicleId = pending.fix().vehicleId();
        int capacity = Math.max(1, properties.getIngest().getQueueCapacity());
        while (true) {
            VehicleLane lane = lanes.computeIfAbsent(vehicleId, id -> new VehicleLane(id, clock.instant()));
            VehicleLane.PendingFix droppedFix = null;
            boolean schedule;
            synchronized (lane) {
                if (lane.retired) {
                    continue;
                }
                lane.queue.addLast(pending);
                if (lane.queue.size() > capacity) {
                    droppedFix = lane.queue.pollFirst();
                }
                schedule = !lane.scheduled;
                lane.scheduled = true;
                lane.lastActivity = clock.instant();
            }
            if (droppedFix != null) {
                droppedCounter.increment();
                dropped.incrementAndGet();
                log.warn("Queue of vehicle {} is full ({}), dropped oldest fix {}",
                    vehicleId, capacity, droppedFix.fix().toLogString());
                droppedFix.result().complete(IngestionResult.rejected(droppedFix.fix(), IngestionResult.DROPPED_BY_BACKPRESSURE));
            }
            if (schedule) {
                ingestionExecutor.execute(() -> drain(lane));
            }
            return;
        }
    }

    private void drain(VehicleLane lane) {
        int batch = Math.max(1, properties.getIngest().getDrainBatchSize());
        for (int i = 0; i < batch; i++) {
            VehicleLane.PendingFix next;
            synchronized (lane) {
                next = lane.queue.pollFirst();
                if (next == null) {
                    lane.scheduled = false;
                    return;
                }
            }
            IngestionResult result;
            try {
                result = process(lane, next.fix());
            } catch (RuntimeException e) {
                log.error("Unexpected failure while processing {}", next.fix().toLogString(), e);
                result = reject(next.fix(), IngestionResult.INTERNAL_ERROR, e.getMessage());
            }
            next.result().complete(result);
        }
        // Yield the worker so a busy vehicle cannot starve the others
        ingestionExecutor.execute(() -> drain(lane));
    }

    /**
     * Evicts lanes of vehicles that sent nothing for {@code tracking.ingest.context-idle}.
     */
    @Scheduled(fixedDelayString = "${tracking.ingest.context-sweep-interval-ms:60000}")
    public void evictIdleLanes() {
        Instant cutoff = clock.instant().minus(properties.getIngest().getContextIdle());
        int evicted = 0;
        for (VehicleLane lane : lanes.values()) {
            synchronized (lane) {
                if (!lane.scheduled && lane.queue.isEmpty() && lane.lastActivity.isBefore(cutoff)) {
                    lane.retired = true;
                    lanes.remove(lane.vehicleId, lane);
                    evicted++;
                }
            }
        }
        if (evicted > 0) {
            log.info("Evicted {} idle vehicle contexts", evicted);
        }
    }

    // ==================== Per-fix pipeline ====================

    private IngestionResult process(VehicleLane lane, FixRecord fix) {
        rehydrate(lane);

        if (lane.lastAcceptedTs != null && !fix.ts().isAfter(lane.lastAcceptedTs)) {
            return markStale(fix);
        }

        Duration storeTimeout = properties.getIngest().getStoreWriteTimeout();
        if (lane.pendingRevert != null) {
            try {
                boundedIo.await("position store revert", storeTimeout, lane.pendingRevert);
                lane.pendingRevert = null;
            } catch (RuntimeException e) {
                return reject(fix, IngestionResult.STORE_UNAVAILABLE, "earlier write of vehicle " + lane.vehicleId + " is still pending");
            }
        }

        boolean stored;
        CompletableFuture<Boolean> write = boundedIo.start(() -> positionStore.putLatest(fix));
        try {
            stored = boundedIo.await("position store write", storeTimeout, write);
        } catch (DeadlineExceededException e) {
            stored = settleLateWrite(lane, fix, write);
            if (!stored) {
                return reject(fix, IngestionResult.STORE_UNAVAILABLE, e.getMessage());
            }
        } catch (RuntimeException e) {
            log.error("Position store write failed, dropping {}", fix.toLogString(), e);
            return reject(fix, IngestionResult.STORE_UNAVAILABLE, e.getMessage());
        }
        if (!stored) {
            return markStale(fix);
        }
        lane.lastAcceptedTs = fix.ts();
        lane.lastAcceptedFix = fix;

        boundedIo.runAsync(() -> positionStore.appendHistory(fix))
            .whenComplete((ignored, error) -> {
                if (error != null) {
                    historyFailedCounter.increment();
                    log.error("History append failed for {}", fix.toLogString(), error);
                }
            });

        ZoneSnapshot snapshot = zoneRegistry.snapshot();
        CompletableFuture<GeofenceEvaluation> geofences = CompletableFuture
            .supplyAsync(() -> geofenceEngine.evaluate(fix, snapshot, lane.memberships), evaluationExecutor)
            .exceptionally(e -> {
                log.error("Geofence evaluation failed for {}", fix.toLogString(), e);
                return GeofenceEvaluation.deferred(lane.memberships.insideZoneIds());
            });
        CompletableFuture<ProximityEvaluation> proximity = CompletableFuture
            .supplyAsync(() -> accidentProximityEngine.evaluate(fix, snapshot, lane.proximityStates), evaluationExecutor)
            .exceptionally(e -> {
                log.error("Accident proximity evaluation failed for {}", fix.toLogString(), e);
                return ProximityEvaluation.skippedEvaluation();
            });
        GeofenceEvaluation geofenceEvaluation = geofences.join();
        ProximityEvaluation proximityEvaluation = proximity.join();

        Instant serverTs = clock.instant();
        List<String> topics = Topics.forFix(fix.tenantId(), fix.vehicleId(), fix.shipmentId());

        subscriptionBus.publish(topics, LocationUpdateEvent.from(fix, serverTs));

        for (GeofenceEdge edge : geofenceEvaluation.edges()) {
            subscriptionBus.publish(topics, GeofenceAlertEvent.from(fix, edge, serverTs));
            alertLogService.recordGeofenceAlert(fix, edge, serverTs);
        }

        for (ProximityActivation activation : proximityEvaluation.activations()) {
            List<String> alertTopics = new ArrayList<>(topics);
            alertTopics.add(Topics.accidentZone(activation.zoneId()));
            subscriptionBus.publish(alertTopics, AccidentProximityAlertEvent.from(fix, activation, serverTs));
            String zoneName = snapshot.accidentZone(activation.zoneId()).map(CachedAccidentZone::name).orElse(null);
            alertLogService.recordProximityAlert(fix, activation, zoneName, serverTs);
        }

        for (ProximityResolution resolution : proximityEvaluation.resolutions()) {
            alertLogService.recordResolution(fix.vehicleId(), resolution);
        }

        acceptedCounter.increment();
        accepted.incrementAndGet();
        log.debug("Accepted {}", fix.toLogString());
        return IngestionResult.accepted(fix, geofenceEvaluation.edges(), proximityEvaluation.activations());
    }

    /**
     * Resolves a hot write that missed its deadline but may still land.
     *
     * If the write is already visible the fix counts as stored and goes through
     * the rest of the pipeline. Otherwise the write is reverted whenever it
     * completes, so a rejected fix never stays visible as the latest position
     * and a resend of it is not taken for a replay.
     *
     * @return true if the fix is stored
     */
    private boolean settleLateWrite(VehicleLane lane, FixRecord fix, CompletableFuture<Boolean> write) {
        try {
            Optional<FixRecord> current = boundedIo.call("position store read",
                properties.getIngest().getStoreWriteTimeout(), () -> positionStore.getLatest(fix.vehicleId()));
            if (current.filter(fix::equals).isPresent()) {
                log.warn("Position store write of {} landed after its deadline, continuing", fix.toLogString());
                return true;
            }
        } catch (RuntimeException e) {
            log.warn("Could not re-read the latest position of vehicle {}: {}", fix.vehicleId(), e.getMessage());
        }
        FixRecord previous = lane.lastAcceptedFix;
        lane.pendingRevert = write
            .thenAccept(landed -> {
                if (Boolean.TRUE.equals(landed)) {
                    positionStore.revertLatest(fix, previous);
                }
            })
            .exceptionally(error -> {
                log.warn("Late position store write of {} could not be settled: {}", fix.toLogString(), error.getMessage());
                return null;
            });
        return false;
    }

    /**
     * Restores the proximity debounce from open alerts in the log, once per lane.
     */
    private void rehydrate(VehicleLane lane) {
        if (lane.rehydrated) {
            return;
        }
        lane.rehydrated = true;
        try {
            List<TrackingAlert> open = boundedIo.call("alert log read", properties.getIngest().getLogWriteTimeout(),
                () -> alertLogService.openProximityAlerts(lane.vehicleId));
            for (TrackingAlert alert : open) {
                lane.proximityStates.restore(alert.getZoneId(), alert.getTs());
            }
            if (!open.isEmpty()) {
                log.info("Restored {} active proximity states for vehicle {}", open.size(), lane.vehicleId);
            }
        } catch (RuntimeException e) {
            log.warn("Could not restore proximity state of vehicle {}: {}", lane.vehicleId, e.getMessage());
        }
    }

    private IngestionResult markStale(FixRecord fix) {
        staleCounter.increment();
        stale.incrementAndGet();
        log.debug("Stale fix ignored: {}", fix.toLogString());
        return IngestionResult.stale(fix);
    }

    private IngestionResult reject(FixRecord fix, String reason, String message) {
        meterRegistry.counter("tracking.fix.rejected", "reason", reason).increment();
        rejected.incrementAndGet();
        log.warn("Rejected fix ({}): {}", reason, message);
        return IngestionResult.rejected(fix, reason);
    }

    // ==================== Validation ====================

    void validate(FixRecord fix) {
        if (fix == null) {
            throw new FixValidationException(IngestionResult.MISSING_VEHICLE, "fix is empty");
        }
        if (fix.tenantId() == null) {
            throw new FixValidationException(IngestionResult.MISSING_TENANT, "tenantId is required");
        }
        if (fix.vehicleId() == null) {
            throw new FixValidationException(IngestionResult.MISSING_VEHICLE, "vehicleId is required");
        }
        if (fix.lat() == null || fix.lon() == null) {
            throw new FixValidationException(IngestionResult.MISSING_COORDINATES, "lat and lon are required");
        }
        if (!(fix.lat() >= -90.0 && fix.lat() <= 90.0)) {
            throw new FixValidationException(IngestionResult.LATITUDE_OUT_OF_RANGE, "lat must be within [-90, 90]: " + fix.lat());
        }
        if (!(fix.lon() >= -180.0 && fix.lon() <= 180.0)) {
            throw new FixValidationException(IngestionResult.LONGITUDE_OUT_OF_RANGE, "lon must be within [-180, 180]: " + fix.lon());
        }
        if (fix.ts() == null) {
            throw new FixValidationException(IngestionResult.MISSING_TIMESTAMP, "ts is required");
        }
        Instant now = clock.instant();
        TrackingProperties.Ingest ingest = properties.getIngest();
        if (fix.ts().isAfter(now.plus(ingest.getMaxFutureSkew()))) {
            throw new FixValidationException(IngestionResult.TIMESTAMP_IN_FUTURE, "ts " + fix.ts() + " is ahead of server time " + now);
        }
        if (fix.ts().isBefore(now.minus(ingest.getMaxAge()))) {
            throw new FixValidationException(IngestionResult.TIMESTAMP_TOO_OLD, "ts " + fix.ts() + " is older than " + ingest.getMaxAge());
        }
        if (fix.speed() != null && !(fix.speed() >= 0.0)) {
            throw new FixValidationException(IngestionResult.INVALID_SPEED, "speed must be >= 0: " + fix.speed());
        }
        if (fix.heading() != null && !(fix.heading() >= 0.0 && fix.heading() <= 360.0)) {
            throw new FixValidationException(IngestionResult.INVALID_HEADING, "heading must be within [0, 360]: " + fix.heading());
        }
        if (fix.accuracy() != null && !(fix.accuracy() >= 0.0)) {
            throw new FixValidationException(IngestionResult.INVALID_ACCURACY, "accuracy must be >= 0: " + fix.accuracy());
        }
    }

    // ==================== Statistics ====================

    public IngestionStats stats() {
        int queued = 0;
        for (VehicleLane lane : lanes.values()) {
            synchronized (lane) {
                queued += lane.queue.size();
            }
        }
        return new IngestionStats(lanes.size(), queued, accepted.get(), stale.get(), rejected.get(), dropped.get());
    }

    public record IngestionStats(int activeVehicles, int queuedFixes, long accepted, long staleIgnored,
                                 long rejected, long droppedByBackpressure) {
    }
}
