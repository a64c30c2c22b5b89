package com.logimatrix.tracking.exception;

/**
 * A registry update could not be applied. The previous snapshot stays active.
 */
public class ZoneRegistryException extends TrackingException {

    public ZoneRegistryException(String message, Throwable cause) {
        super("zone_registry_update_failed", message, cause);
    }
}
