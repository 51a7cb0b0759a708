package com.authcore.backend.modules.ratelimit.application;

import java.time.Duration;

/**
 * Outcome of one admission attempt. {@code retryAfter} is {@link Duration#ZERO} when allowed.
 */
public record RateLimitDecision(boolean allowed, int limit, int remaining, Duration retryAfter) {

    public static RateLimitDecision allow(int limit, int remaining) {
        return new RateLimitDecision(true, limit, Math.max(0, remaining), Duration.ZERO);
    }

    public static RateLimitDecision deny(int limit, Duration retryAfter) {
        Duration safeRetryAfter = retryAfter == null || retryAfter.isNegative() ? Duration.ZERO : retryAfter;
        return new RateLimitDecision(false, limit, 0, safeRetryAfter);
    }

    /**
     * Whole seconds a client should wait, rounded up and never below one.
     */
    public long retryAfterSeconds() {
        long millis = retryAfter.toMillis();
        long seconds = (millis + 999) / 1000;
        return Math.max(1, seconds);
    }
}
