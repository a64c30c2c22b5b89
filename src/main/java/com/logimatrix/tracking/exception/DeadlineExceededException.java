package com.logimatrix.tracking.exception;

import java.time.Duration;

/**
 * An I/O step did not finish within its deadline.
 */
public class DeadlineExceededException extends TrackingException {

    public DeadlineExceededException(String operation, Duration deadline) {
        super("deadline_exceeded", operation + " exceeded its " + deadline.toMillis() + "ms deadline");
    }
}
