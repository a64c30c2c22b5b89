package com.logimatrix.tracking.exception;

/**
 * Tenant or vehicle is not known to the fleet directory.
 */
public class UnknownEntityException extends TrackingException {

    public UnknownEntityException(String errorCode, String message) {
        super(errorCode, message);
    }
}
