package com.logimatrix.tracking.exception;

/**
 * A fix failed validation; {@link #getErrorCode()} is the rejection reason.
 */
public class FixValidationException extends TrackingException {

    public FixValidationException(String reason, String message) {
        super(reason, message);
    }
}
