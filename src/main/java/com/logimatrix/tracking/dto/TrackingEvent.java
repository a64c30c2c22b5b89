package com.logimatrix.tracking.dto;

/**
 * Event published on the subscription bus. {@link #type()} is the wire
 * discriminator clients switch on.
 */
public interface TrackingEvent {

    String type();

    String tenantId();

    String vehicleId();
}
