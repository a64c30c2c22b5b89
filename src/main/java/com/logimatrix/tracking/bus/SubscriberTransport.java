package com.logimatrix.tracking.bus;

import com.logimatrix.tracking.dto.TrackingEvent;

/**
 * One connected subscriber as seen by the bus (a STOMP session, a test sink, ...).
 * The transport owns the connection; the bus only holds it while registered.
 */
public interface SubscriberTransport {

    String id();

    /**
     * Delivers one event. May block; the bus calls it from its dispatch pool,
     * never from the ingestion path.
     */
    void send(TrackingEvent event) throws Exception;

    /**
     * Called once when the bus drops the subscriber.
     */
    void close(String reason);
}
