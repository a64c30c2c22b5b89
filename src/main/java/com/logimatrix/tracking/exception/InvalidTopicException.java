package com.logimatrix.tracking.exception;

public class InvalidTopicException extends TrackingException {

    public InvalidTopicException(String topic) {
        super("invalid_topic", "Unsupported topic: " + topic);
    }
}
