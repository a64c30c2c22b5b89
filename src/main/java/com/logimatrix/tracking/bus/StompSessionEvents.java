package com.logimatrix.tracking.bus;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

/**
 * Ties STOMP session lifecycle to bus registration: a connected session is a
 * subscriber, a disconnected one leaves every topic.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StompSessionEvents {

    private final SubscriptionBus subscriptionBus;
    private final SimpMessagingTemplate messagingTemplate;

    @EventListener
    public void onConnected(SessionConnectedEvent event) {
        String sessionId = SimpMessageHeaderAccessor.getSessionId(event.getMessage().getHeaders());
        if (sessionId == null) {
            return;
        }
        subscriptionBus.register(new StompSubscriberTransport(sessionId, messagingTemplate));
        log.info("STOMP session {} connected", sessionId);
    }

    @EventListener
    public void onDisconnected(SessionDisconnectEvent event) {
        subscriptionBus.unregister(event.getSessionId());
        log.info("STOMP session {} disconnected ({})", event.getSessionId(), event.getCloseStatus());
    }
}
