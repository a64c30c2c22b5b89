package com.logimatrix.tracking.bus;

import com.logimatrix.tracking.dto.TrackingEvent;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.util.Map;

/**
 * Bus subscriber backed by one STOMP session.
 *
 * Sessions are anonymous, so events are addressed to the session id: the user
 * destination resolver maps {@code /user/queue/events} of a session whose id
 * equals the target "user" to that single session.
 */
public class StompSubscriberTransport implements SubscriberTransport {

    public static final String EVENTS_DESTINATION = "/queue/events";

    private final String sessionId;
    private final SimpMessagingTemplate messagingTemplate;
    private final MessageHeaders headers;

    public StompSubscriberTransport(String sessionId, SimpMessagingTemplate messagingTemplate) {
        this.sessionId = sessionId;
        this.messagingTemplate = messagingTemplate;
        this.headers = headersFor(sessionId);
    }

    @Override
    public String id() {
        return sessionId;
    }

    @Override
    public void send(TrackingEvent event) {
        messagingTemplate.convertAndSendToUser(sessionId, EVENTS_DESTINATION, event, headers);
    }

    /**
     * The broker session stays open; the client is told it no longer receives
     * events and has to re-join after re-fetching state.
     */
    @Override
    public void close(String reason) {
        messagingTemplate.convertAndSendToUser(sessionId, EVENTS_DESTINATION,
            Map.of("type", "subscription_closed", "reason", reason), headers);
    }

    /**
     * Headers that route a user-destination message to exactly one session.
     */
    public static MessageHeaders headersFor(String sessionId) {
        SimpMessageHeaderAccessor accessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        accessor.setSessionId(sessionId);
        accessor.setLeaveMutable(true);
        return accessor.getMessageHeaders();
    }
}
