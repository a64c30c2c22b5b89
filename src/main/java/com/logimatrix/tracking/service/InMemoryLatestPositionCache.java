package com.logimatrix.tracking.service;

import com.logimatrix.tracking.dto.FixRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-instance hot cache for development and tests
 * ({@code tracking.position.cache=memory}).
 */
@Component
@ConditionalOnProperty(prefix = "tracking.position", name = "cache", havingValue = "memory")
@Slf4j
public class InMemoryLatestPositionCache implements LatestPositionCache {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryLatestPositionCache(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean putIfNewer(String key, FixRecord fix, Duration ttl) {
        Instant now = clock.instant();
        boolean[] stored = {false};
        entries.compute(key, (k, current) -> {
            if (current != null && !current.isExpired(now) && !fix.ts().isAfter(current.fix().ts())) {
                return current;
            }
            stored[0] = true;
            return new Entry(fix, now.plus(ttl));
        });
        return stored[0];
    }

    @Override
    public Optional<FixRecord> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null || entry.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(entry.fix());
    }

    @Override
    public boolean replaceIfCurrent(String key, FixRecord expected, FixRecord replacement, Duration ttl) {
        Instant now = clock.instant();
        boolean[] replaced = {false};
        entries.computeIfPresent(key, (k, current) -> {
            if (current.isExpired(now) || !current.fix().equals(expected)) {
                return current;
            }
            replaced[0] = true;
            return replacement == null ? null : new Entry(replacement, now.plus(ttl));
        });
        return replaced[0];
    }

    @Override
    public int evictExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now));
        int evicted = before - entries.size();
        if (evicted > 0) {
            log.debug("Evicted {} expired hot positions", evicted);
        }
        return Math.max(evicted, 0);
    }

    private record Entry(FixRecord fix, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
