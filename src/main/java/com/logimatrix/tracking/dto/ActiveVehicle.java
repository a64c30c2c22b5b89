package com.logimatrix.tracking.dto;

/**
 * A tenant's vehicle with its latest hot position, or a null location when it
 * has not reported within the hot TTL.
 */
public record ActiveVehicle(String vehicleId, FixRecord location) {
}
