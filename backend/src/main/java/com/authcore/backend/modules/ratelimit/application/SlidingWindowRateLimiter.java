package com.authcore.backend.modules.ratelimit.application;

import java.time.Clock;
import java.time.Duration;
import java.util.OptionalLong;
import java.util.UUID;

import com.authcore.backend.global.store.RevocationStore;
import com.authcore.backend.global.store.StoreException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Sliding-window log limiter over a shared sorted set per key, so every instance sees the
 * same window. Scores are admission times in epoch milliseconds.
 * <p>
 * The steps are separate commands, not a script: two instances racing on the last free
 * slot can both be admitted. Store failures propagate as {@link StoreException}; the caller
 * decides whether to fail open.
 */
@Service
public class SlidingWindowRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    static final String KEY_PREFIX = "ratelimit:";
    private static final Duration EXPIRY_BUFFER = Duration.ofMinutes(1);

    private final RevocationStore store;
    private final Clock clock;

    public SlidingWindowRateLimiter(RevocationStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public RateLimitDecision allow(String key, int limit, Duration window) {
        String redisKey = KEY_PREFIX + key;
        long now = clock.millis();
        long count = trimAndCount(redisKey, now, window);

        if (count >= limit) {
            OptionalLong oldest = store.oldestScore(redisKey);
            Duration retryAfter = oldest.isPresent()
                    ? window.minusMillis(now - oldest.getAsLong())
                    : window;
            return RateLimitDecision.deny(limit, retryAfter);
        }

        store.addScored(redisKey, now + "-" + UUID.randomUUID(), now);
        try {
            store.expireKey(redisKey, window.plus(EXPIRY_BUFFER));
        } catch (StoreException ex) {
            log.warn("Failed to set expiry on rate limit key {}", redisKey, ex);
        }
        return RateLimitDecision.allow(limit, (int) (limit - count - 1));
    }

    public int remaining(String key, int limit, Duration window) {
        long count = trimAndCount(KEY_PREFIX + key, clock.millis(), window);
        return (int) Math.max(0, limit - count);
    }

    private long trimAndCount(String redisKey, long now, Duration window) {
        long windowStart = Math.max(0, now - window.toMillis());
        store.removeScoredUpTo(redisKey, windowStart);
        return store.countScoredAbove(redisKey, windowStart);
    }
}
