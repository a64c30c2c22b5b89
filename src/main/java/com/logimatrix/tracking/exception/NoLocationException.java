package com.logimatrix.tracking.exception;

/**
 * No recent fix exists in the hot position cache. This means "not seen
 * recently", not "vehicle deleted".
 */
public class NoLocationException extends TrackingException {

    public NoLocationException(String subject) {
        super("no_location", "No recent location for " + subject);
    }
}
