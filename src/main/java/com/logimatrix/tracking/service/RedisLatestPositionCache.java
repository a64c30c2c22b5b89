package com.logimatrix.tracking.service;

import com.logimatrix.tracking.dto.FixRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Redis-backed hot cache shared by every engine instance.
 *
 * Keys are written with {@code SET ... PX ttl} so Redis expires them natively.
 * The newer-than check runs in an optimistic WATCH/MULTI/EXEC transaction: a
 * vehicle key has a single writer, but several vehicles can report the same
 * shipment, so the shipment key may see concurrent writers.
 */
@Component
@ConditionalOnProperty(prefix = "tracking.position", name = "cache", havingValue = "redis", matchIfMissing = true)
@Slf4j
public class RedisLatestPositionCache implements LatestPositionCache {

    private static final int MAX_CAS_ATTEMPTS = 3;

    private final RedisTemplate<String, FixRecord> fixRedisTemplate;

    public RedisLatestPositionCache(@Qualifier("fixRedisTemplate") RedisTemplate<String, FixRecord> fixRedisTemplate) {
        this.fixRedisTemplate = fixRedisTemplate;
    }

    @Override
    public boolean putIfNewer(String key, FixRecord fix, Duration ttl) {
        for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            CasOutcome outcome = fixRedisTemplate.execute(new CompareAndSet(key, fix, ttl));
            if (outcome == CasOutcome.STORED) {
                return true;
            }
            if (outcome == CasOutcome.STALE) {
                return false;
            }
            log.debug("Concurrent write on {}, retrying ({}/{})", key, attempt, MAX_CAS_ATTEMPTS);
        }
        log.warn("Gave up writing {} after {} conflicting attempts", key, MAX_CAS_ATTEMPTS);
        return false;
    }

    @Override
    public Optional<FixRecord> get(String key) {
        return Optional.ofNullable(fixRedisTemplate.opsForValue().get(key));
    }

    @Override
    public boolean replaceIfCurrent(String key, FixRecord expected, FixRecord replacement, Duration ttl) {
        for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            CasOutcome outcome = fixRedisTemplate.execute(new ReplaceIfCurrent(key, expected, replacement, ttl));
            if (outcome == CasOutcome.STORED) {
                return true;
            }
            if (outcome == CasOutcome.STALE) {
                return false;
            }
        }
        log.warn("Gave up replacing {} after {} conflicting attempts", key, MAX_CAS_ATTEMPTS);
        return false;
    }

    private enum CasOutcome {
        STORED,
        STALE,
        CONFLICT
    }

    private record CompareAndSet(String key, FixRecord fix, Duration ttl) implements SessionCallback<CasOutcome> {

        @Override
        @SuppressWarnings("unchecked")
        public <K, V> CasOutcome execute(RedisOperations<K, V> operations) throws DataAccessException {
            RedisOperations<String, FixRecord> ops = (RedisOperations<String, FixRecord>) operations;
            ops.watch(key);
            FixRecord current = ops.opsForValue().get(key);
            if (current != null && current.ts() != null && !fix.ts().isAfter(current.ts())) {
                ops.unwatch();
                return CasOutcome.STALE;
            }
            ops.multi();
            ops.opsForValue().set(key, fix, ttl);
            List<Object> results = ops.exec();
            return results == null || results.isEmpty() ? CasOutcome.CONFLICT : CasOutcome.STORED;
        }
    }

    private record ReplaceIfCurrent(String key, FixRecord expected, FixRecord replacement, Duration ttl)
        implements SessionCallback<CasOutcome> {

        @Override
        @SuppressWarnings("unchecked")
        public <K, V> CasOutcome execute(RedisOperations<K, V> operations) throws DataAccessException {
            RedisOperations<String, FixRecord> ops = (RedisOperations<String, FixRecord>) operations;
            ops.watch(key);
            FixRecord current = ops.opsForValue().get(key);
            if (!expected.equals(current)) {
                ops.unwatch();
                return CasOutcome.STALE;
            }
            ops.multi();
            if (replacement == null) {
                ops.delete(key);
            } else {
                ops.opsForValue().set(key, replacement, ttl);
            }
            List<Object> results = ops.exec();
            return results == null || results.isEmpty() ? CasOutcome.CONFLICT : CasOutcome.STORED;
        }
    }
}
