package com.logimatrix.tracking.service;

import com.logimatrix.tracking.dto.FixRecord;
import com.logimatrix.tracking.dto.IngestionResult;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;

/**
 * Serialization context of one vehicle.
 *
 * Queue and scheduling flag are guarded by the lane's monitor. The evaluation
 * state (last accepted ts, geofence memberships, proximity debounce) is only
 * touched by the single drain task running for the lane.
 */
final class VehicleLane {

    final String vehicleId;
    final Deque<PendingFix> queue = new ArrayDeque<>();
    final GeofenceMemberships memberships = new GeofenceMemberships();
    final ProximityStates proximityStates = new ProximityStates();

    /** Guarded by this. */
    boolean scheduled;
    /** Guarded by this; a retired lane was evicted and accepts no more fixes. */
    boolean retired;

    Instant lastAcceptedTs;
    FixRecord lastAcceptedFix;
    /** Undo of a hot write that outlived its deadline; the next write waits for it. */
    CompletableFuture<Void> pendingRevert;
    boolean rehydrated;
    volatile Instant lastActivity;

    VehicleLane(String vehicleId, Instant createdAt) {
        this.vehicleId = vehicleId;
        this.lastActivity = createdAt;
    }

    record PendingFix(FixRecord fix, CompletableFuture<IngestionResult> result) {
    }
}
