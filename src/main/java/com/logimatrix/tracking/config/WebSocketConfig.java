package com.logimatrix.tracking.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * WebSocket Configuration for real-time tracking
 *
 * Architecture:
 * - STOMP protocol over WebSocket
 * - In-memory message broker carries per-session queues
 * - Topic rooms (vehicle:, shipment:, tenant:, accident-zone:) live in the
 *   subscription bus, not in broker destinations
 *
 * Endpoints:
 * - /ws/tracking: WebSocket connection endpoint
 * - /app/tracking/fix, /app/tracking/fix/batch, /app/tracking/telemetry: producers
 * - /app/tracking/join, /app/tracking/leave: room membership
 * - /user/queue/events: events of the joined rooms
 * - /user/queue/reply: acknowledgements
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    @Value("${tracking.websocket.endpoint:/ws/tracking}")
    private String websocketEndpoint;

    @Value("${tracking.websocket.allowed-origins:*}")
    private String allowedOrigins;

    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        config.enableSimpleBroker("/topic", "/queue");

        // Prefix for messages FROM clients TO server
        config.setApplicationDestinationPrefixes("/app");

        config.setUserDestinationPrefix("/user");
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint(websocketEndpoint)
                .setAllowedOriginPatterns(allowedOrigins)
                .withSockJS();

        // Native WebSocket clients
        registry.addEndpoint(websocketEndpoint)
                .setAllowedOriginPatterns(allowedOrigins);
    }
}
