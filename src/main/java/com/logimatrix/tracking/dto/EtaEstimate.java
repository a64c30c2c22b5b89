package com.logimatrix.tracking.dto;

import com.logimatrix.tracking.geo.GeoPoint;

import java.time.Instant;

/**
 * ETA from the latest hot position of a vehicle (or shipment) to a destination.
 *
 * @param remainingDistanceKm great-circle distance to the destination
 * @param speedEstimateKmh    speed used for the estimate
 * @param etaSeconds          remaining travel time, rounded to whole seconds
 * @param confidence          high, medium or low depending on sample count and data age
 * @param speedSource         which estimator produced the speed
 * @param sampleCount         recent samples used by the weighted mean
 * @param origin              position the estimate starts from
 * @param destination         requested destination
 * @param positionTs          timestamp of the origin fix
 * @param estimatedArrival    positionTs plus etaSeconds
 */
public record EtaEstimate(
    double remainingDistanceKm,
    double speedEstimateKmh,
    long etaSeconds,
    EtaConfidence confidence,
    SpeedSource speedSource,
    int sampleCount,
    GeoPoint origin,
    GeoPoint destination,
    Instant positionTs,
    Instant estimatedArrival
) {
}
