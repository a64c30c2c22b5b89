package com.logimatrix.tracking.exception;

public class ZoneNotFoundException extends TrackingException {

    public ZoneNotFoundException(String zoneId) {
        super("zone_not_found", "Zone not found: " + zoneId);
    }
}
