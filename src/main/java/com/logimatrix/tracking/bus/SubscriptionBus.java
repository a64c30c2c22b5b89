package com.logimatrix.tracking.bus;

import com.logimatrix.tracking.dto.TrackingEvent;

import java.util.Collection;
import java.util.Set;

/**
 * Named-room multicast with join/leave semantics and at-most-once delivery.
 *
 * Publishing never blocks on a subscriber: every subscriber has a bounded
 * outbound buffer, and one whose buffer is full (or whose delivery fails or
 * exceeds the publish deadline) is closed and removed from every topic.
 * There is no durable queue; a reconnecting client re-fetches state.
 */
public interface SubscriptionBus {

    /**
     * Registers a subscriber. Registering the same id again is a no-op.
     */
    void register(SubscriberTransport transport);

    /**
     * Removes a subscriber from every topic without closing its transport.
     */
    void unregister(String subscriberId);

    /**
     * @throws com.logimatrix.tracking.exception.InvalidTopicException if the topic is not well-known
     */
    void join(String subscriberId, String topic);

    void leave(String subscriberId, String topic);

    /**
     * Queues the event for every subscriber of the topic.
     *
     * @return number of subscribers the event was queued for
     */
    default int publish(String topic, TrackingEvent event) {
        return publish(Set.of(topic), event);
    }

    /**
     * Queues the event once for every subscriber of any of the topics, so a
     * subscriber joined to several of them receives a single copy.
     */
    int publish(Collection<String> topics, TrackingEvent event);

    Set<String> topicsOf(String subscriberId);

    BusStats stats();

    record BusStats(int subscribers, int topics, long published, long evicted) {
    }
}
