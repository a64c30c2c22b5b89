package com.logimatrix.tracking.controller;

import com.logimatrix.tracking.bus.StompSubscriberTransport;
import com.logimatrix.tracking.bus.SubscriptionBus;
import com.logimatrix.tracking.dto.FixRecord;
import com.logimatrix.tracking.dto.IngestionResult;
import com.logimatrix.tracking.dto.TelemetryRecord;
import com.logimatrix.tracking.dto.TelemetryResult;
import com.logimatrix.tracking.dto.TopicRequest;
import com.logimatrix.tracking.exception.TrackingException;
import com.logimatrix.tracking.service.IngestionCoordinator;
import com.logimatrix.tracking.service.TelemetryIngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.stereotype.Controller;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * WebSocket Controller for real-time tracking
 *
 * Message Flow:
 * 1. Device sends a fix to /app/tracking/fix (or a batch to /app/tracking/fix/batch)
 * 2. The fix is queued on its vehicle's lane; the handler thread does not wait
 * 3. The ingestion outcome is sent to the sender via /user/queue/reply
 * 4. Derived events reach every session that joined a matching room, on /user/queue/events
 *
 * Room membership:
 * - Send {"topic":"vehicle:VH-1"} to /app/tracking/join or /app/tracking/leave
 * - Rooms: vehicle:, shipment:, tenant:, accident-zone:
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class TrackingStreamingController {

    static final String REPLY_DESTINATION = "/queue/reply";

    private final IngestionCoordinator ingestionCoordinator;
    private final TelemetryIngestionService telemetryIngestionService;
    private final SubscriptionBus subscriptionBus;
    private final SimpMessagingTemplate messagingTemplate;

    /**
     * Handle an incoming fix from a device.
     */
    @MessageMapping("/tracking/fix")
    public void handleFix(@Payload FixRecord fix, SimpMessageHeaderAccessor headers) {
        String sessionId = headers.getSessionId();
        log.debug("Received fix over STOMP from session {}", sessionId);

        ingestionCoordinator.submit(fix)
            .thenAccept(result -> reply(sessionId, result));
    }

    /**
     * Handle a batch of fixes. One reply per fix, then a batch summary once all
     * outcomes are known.
     */
    @MessageMapping("/tracking/fix/batch")
    public void handleFixBatch(@Payload List<FixRecord> fixes, SimpMessageHeaderAccessor headers) {
        String sessionId = headers.getSessionId();
        log.info("Received batch of {} fixes from session {}", fixes.size(), sessionId);

        List<CompletableFuture<IngestionResult>> futures = ingestionCoordinator.submitAll(fixes);
        futures.forEach(future -> future.thenAccept(result -> reply(sessionId, result)));

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
            .thenRun(() -> {
                long accepted = futures.stream().map(CompletableFuture::join).filter(IngestionResult::isAccepted).count();
                reply(sessionId, Map.of(
                    "status", "OK",
                    "batchSize", fixes.size(),
                    "accepted", accepted,
                    "timestamp", Instant.now().toString()
                ));
            });
    }

    @MessageMapping("/tracking/telemetry")
    @SendToUser(REPLY_DESTINATION)
    public TelemetryResult handleTelemetry(@Payload TelemetryRecord telemetry) {
        return telemetryIngestionService.ingest(telemetry);
    }

    @MessageMapping("/tracking/join")
    @SendToUser(REPLY_DESTINATION)
    public Map<String, Object> join(@Payload TopicRequest request, SimpMessageHeaderAccessor headers) {
        subscriptionBus.join(headers.getSessionId(), request.topic());
        return Map.of(
            "type", "JOINED",
            "topic", request.topic().trim(),
            "timestamp", Instant.now().toString()
        );
    }

    @MessageMapping("/tracking/leave")
    @SendToUser(REPLY_DESTINATION)
    public Map<String, Object> leave(@Payload TopicRequest request, SimpMessageHeaderAccessor headers) {
        subscriptionBus.leave(headers.getSessionId(), request.topic());
        return Map.of(
            "type", "LEFT",
            "topic", request.topic().trim(),
            "timestamp", Instant.now().toString()
        );
    }

    /**
     * Health check for the WebSocket connection.
     */
    @MessageMapping("/tracking/ping")
    @SendToUser(REPLY_DESTINATION)
    public Map<String, Object> handlePing() {
        return Map.of(
            "type", "PONG",
            "serverTime", Instant.now().toString(),
            "status", "OK"
        );
    }

    @MessageExceptionHandler(TrackingException.class)
    @SendToUser("/queue/errors")
    public Map<String, Object> handleTrackingError(TrackingException e) {
        log.warn("STOMP request failed: {}", e.getMessage());
        return Map.of(
            "status", "ERROR",
            "error", e.getErrorCode(),
            "message", e.getMessage(),
            "timestamp", Instant.now().toString()
        );
    }

    @MessageExceptionHandler({IllegalArgumentException.class, IllegalStateException.class})
    @SendToUser("/queue/errors")
    public Map<String, Object> handleBadRequest(RuntimeException e) {
        log.warn("STOMP request rejected: {}", e.getMessage());
        return Map.of(
            "status", "ERROR",
            "error", "bad_request",
            "message", String.valueOf(e.getMessage()),
            "timestamp", Instant.now().toString()
        );
    }

    private void reply(String sessionId, Object payload) {
        if (sessionId == null) {
            return;
        }
        messagingTemplate.convertAndSendToUser(sessionId, REPLY_DESTINATION, payload,
            StompSubscriberTransport.headersFor(sessionId));
    }
}
