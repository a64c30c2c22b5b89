package com.logimatrix.tracking.exception;

/**
 * Base class of the engine's domain exceptions. Carries a machine-readable
 * error code used in API error bodies.
 */
public abstract class TrackingException extends RuntimeException {

    private final String errorCode;

    protected TrackingException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected TrackingException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
