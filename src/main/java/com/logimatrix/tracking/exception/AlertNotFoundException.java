package com.logimatrix.tracking.exception;

import java.util.UUID;

public class AlertNotFoundException extends TrackingException {

    public AlertNotFoundException(UUID alertId) {
        super("alert_not_found", "Alert not found: " + alertId);
    }
}
