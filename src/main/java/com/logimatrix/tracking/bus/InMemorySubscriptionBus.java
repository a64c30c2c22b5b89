package com.logimatrix.tracking.bus;

import com.logimatrix.tracking.config.TrackingProperties;
import com.logimatrix.tracking.dto.TrackingEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process subscription bus.
 *
 * Topic membership is a weak back-reference (topic -> subscriber id); the
 * subscriber record owns the transport. Each subscriber has a bounded FIFO
 * buffer drained by at most one dispatch task at a time, which keeps per
 * subscriber delivery in publish order.
 */
@Component
@Slf4j
public class InMemorySubscriptionBus implements SubscriptionBus {

    private final Map<String, Subscriber> subscribers = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> topics = new ConcurrentHashMap<>();
    private final Executor dispatchExecutor;
    private final int bufferSize;
    private final Duration publishTimeout;
    private final Counter evictedCounter;
    private final AtomicLong published = new AtomicLong();
    private final AtomicLong evicted = new AtomicLong();

    public InMemorySubscriptionBus(@Qualifier("busDispatchExecutor") Executor dispatchExecutor,
                                   TrackingProperties properties,
                                   MeterRegistry meterRegistry) {
        this.dispatchExecutor = dispatchExecutor;
        this.bufferSize = properties.getBus().getSubscriberBufferSize();
        this.publishTimeout = properties.getBus().getPublishTimeout();
        this.evictedCounter = meterRegistry.counter("tracking.bus.subscriber.evicted");
    }

    @Override
    public void register(SubscriberTransport transport) {
        subscribers.computeIfAbsent(transport.id(), id -> {
            log.debug("Subscriber {} registered", id);
            return new Subscriber(transport, new ArrayBlockingQueue<>(bufferSize));
        });
    }

    @Override
    public void unregister(String subscriberId) {
        Subscriber subscriber = subscribers.remove(subscriberId);
        if (subscriber != null) {
            subscriber.closed.set(true);
            detach(subscriber);
            log.debug("Subscriber {} unregistered", subscriberId);
        }
    }

    @Override
    public void join(String subscriberId, String topic) {
        String validTopic = Topics.validate(topic);
        Subscriber subscriber = subscribers.get(subscriberId);
        if (subscriber == null || subscriber.closed.get()) {
            throw new IllegalStateException("Subscriber not registered: " + subscriberId);
        }
        topics.compute(validTopic, (t, members) -> {
            Set<String> updated = members != null ? members : ConcurrentHashMap.newKeySet();
            updated.add(subscriberId);
            return updated;
        });
        subscriber.joined.add(validTopic);
        log.debug("Subscriber {} joined {}", subscriberId, validTopic);
    }

    @Override
    public void leave(String subscriberId, String topic) {
        String validTopic = Topics.validate(topic);
        removeFromTopic(validTopic, subscriberId);
        Subscriber subscriber = subscribers.get(subscriberId);
        if (subscriber != null) {
            subscriber.joined.remove(validTopic);
        }
        log.debug("Subscriber {} left {}", subscriberId, validTopic);
    }

    @Override
    public int publish(Collection<String> targetTopics, TrackingEvent event) {
        Set<String> recipients = new LinkedHashSet<>();
        for (String topic : targetTopics) {
            recipients.addAll(topics.getOrDefault(topic, Set.of()));
        }

        int queued = 0;
        for (String subscriberId : recipients) {
            Subscriber subscriber = subscribers.get(subscriberId);
            if (subscriber == null || subscriber.closed.get()) {
                continue;
            }
            if (!subscriber.buffer.offer(event)) {
                evict(subscriber, "outbound buffer full");
                continue;
            }
            queued++;
            scheduleDrain(subscriber);
        }
        published.incrementAndGet();
        return queued;
    }

    @Override
    public Set<String> topicsOf(String subscriberId) {
        Subscriber subscriber = subscribers.get(subscriberId);
        return subscriber == null ? Set.of() : Set.copyOf(subscriber.joined);
    }

    @Override
    public BusStats stats() {
        return new BusStats(subscribers.size(), topics.size(), published.get(), evicted.get());
    }

    private void scheduleDrain(Subscriber subscriber) {
        if (subscriber.draining.compareAndSet(false, true)) {
            dispatchExecutor.execute(() -> drain(subscriber));
        }
    }

    private void drain(Subscriber subscriber) {
        while (true) {
            TrackingEvent event;
            while (!subscriber.closed.get() && (event = subscriber.buffer.poll()) != null) {
                if (!deliver(subscriber, event)) {
                    return;
                }
            }
            subscriber.draining.set(false);
            // A publish may have queued an event after the last poll but before the flag was cleared
            if (subscriber.closed.get() || subscriber.buffer.isEmpty()
                || !subscriber.draining.compareAndSet(false, true)) {
                return;
            }
        }
    }

    private boolean deliver(Subscriber subscriber, TrackingEvent event) {
        long started = System.nanoTime();
        try {
            subscriber.transport.send(event);
        } catch (Exception e) {
            evict(subscriber, "delivery failed: " + e.getMessage());
            return false;
        }
        long elapsedNanos = System.nanoTime() - started;
        if (elapsedNanos > publishTimeout.toNanos()) {
            evict(subscriber, "delivery exceeded " + publishTimeout.toMillis() + "ms");
            return false;
        }
        return true;
    }

    private void evict(Subscriber subscriber, String reason) {
        if (!subscriber.closed.compareAndSet(false, true)) {
            return;
        }
        String id = subscriber.transport.id();
        subscribers.remove(id, subscriber);
        detach(subscriber);
        subscriber.buffer.clear();
        evictedCounter.increment();
        evicted.incrementAndGet();
        log.warn("Evicted subscriber {}: {}", id, reason);
        try {
            subscriber.transport.close(reason);
        } catch (RuntimeException e) {
            log.warn("Closing subscriber {} failed: {}", id, e.getMessage());
        }
    }

    private void detach(Subscriber subscriber) {
        String id = subscriber.transport.id();
        for (String topic : subscriber.joined) {
            removeFromTopic(topic, id);
        }
        subscriber.joined.clear();
    }

    private void removeFromTopic(String topic, String subscriberId) {
        topics.computeIfPresent(topic, (t, members) -> {
            members.remove(subscriberId);
            return members.isEmpty() ? null : members;
        });
    }

    private static final class Subscriber {
        private final SubscriberTransport transport;
        private final BlockingQueue<TrackingEvent> buffer;
        private final Set<String> joined = ConcurrentHashMap.newKeySet();
        private final AtomicBoolean draining = new AtomicBoolean();
        private final AtomicBoolean closed = new AtomicBoolean();

        private Subscriber(SubscriberTransport transport, BlockingQueue<TrackingEvent> buffer) {
            this.transport = transport;
            this.buffer = buffer;
        }
    }
}
