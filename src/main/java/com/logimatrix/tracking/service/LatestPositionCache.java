package com.logimatrix.tracking.service;

import com.logimatrix.tracking.dto.FixRecord;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value store of the latest fix per key with a TTL.
 *
 * Writes are last-writer-wins under timestamp comparison: a fix replaces the
 * stored one only if its {@code ts} is strictly newer.
 */
public interface LatestPositionCache {

    /**
     * Stores the fix if it is newer than the current entry and refreshes the TTL.
     *
     * @return true if the fix was stored, false if it was discarded as stale
     */
    boolean putIfNewer(String key, FixRecord fix, Duration ttl);

    Optional<FixRecord> get(String key);

    /**
     * Replaces the entry only while it still holds {@code expected}. A null
     * {@code replacement} deletes the key.
     *
     * @return true if the entry held {@code expected} and was replaced
     */
    boolean replaceIfCurrent(String key, FixRecord expected, FixRecord replacement, Duration ttl);

    /**
     * Drops expired entries. Backends with native expiry do nothing.
     */
    default int evictExpired() {
        return 0;
    }
}
