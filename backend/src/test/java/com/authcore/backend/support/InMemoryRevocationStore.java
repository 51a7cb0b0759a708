package com.authcore.backend.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalLong;
import java.util.TreeMap;

import com.authcore.backend.global.store.RevocationStore;
import com.authcore.backend.global.store.StoreUnavailableException;

/**
 * Single-lock stand-in for Redis. Expiry follows the supplied clock.
 */
public class InMemoryRevocationStore implements RevocationStore {

    private final Clock clock;
    private final Map<String, Instant> expiries = new HashMap<>();
    private final Map<String, TreeMap<String, Long>> sortedSets = new HashMap<>();

    private volatile boolean unavailable;
    private volatile boolean failExpire;

    public InMemoryRevocationStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized void setWithTtl(String key, Duration ttl) {
        check();
        expiries.put(key, clock.instant().plus(ttl));
    }

    @Override
    public synchronized boolean setIfAbsentWithTtl(String key, Duration ttl) {
        check();
        if (live(key)) {
            return false;
        }
        expiries.put(key, clock.instant().plus(ttl));
        return true;
    }

    @Override
    public synchronized boolean exists(String key) {
        check();
        return live(key);
    }

    @Override
    public synchronized void delete(String key) {
        check();
        expiries.remove(key);
        sortedSets.remove(key);
    }

    @Override
    public synchronized void addScored(String key, String member, long score) {
        check();
        sortedSets.computeIfAbsent(key, ignored -> new TreeMap<>()).put(member, score);
    }

    @Override
    public synchronized long removeScoredUpTo(String key, long maxScore) {
        check();
        TreeMap<String, Long> set = sortedSets.get(key);
        if (set == null) {
            return 0;
        }
        int before = set.size();
        set.values().removeIf(score -> score <= maxScore);
        return before - set.size();
    }

    @Override
    public synchronized long countScoredAbove(String key, long minScore) {
        check();
        TreeMap<String, Long> set = sortedSets.get(key);
        if (set == null) {
            return 0;
        }
        return set.values().stream().filter(score -> score > minScore).count();
    }

    @Override
    public synchronized OptionalLong oldestScore(String key) {
        check();
        TreeMap<String, Long> set = sortedSets.get(key);
        if (set == null || set.isEmpty()) {
            return OptionalLong.empty();
        }
        return set.values().stream().mapToLong(Long::longValue).min();
    }

    @Override
    public synchronized void expireKey(String key, Duration ttl) {
        check();
        if (failExpire) {
            throw new StoreUnavailableException("EXPIRE " + key, new IllegalStateException("simulated"));
        }
        expiries.put(key, clock.instant().plus(ttl));
    }

    public synchronized Duration ttlOf(String key) {
        Instant expiry = expiries.get(key);
        return expiry == null ? null : Duration.between(clock.instant(), expiry);
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    public void setFailExpire(boolean failExpire) {
        this.failExpire = failExpire;
    }

    private boolean live(String key) {
        Instant expiry = expiries.get(key);
        if (expiry == null) {
            return false;
        }
        if (!clock.instant().isBefore(expiry)) {
            expiries.remove(key);
            return false;
        }
        return true;
    }

    private void check() {
        if (unavailable) {
            throw new StoreUnavailableException("redis", new IllegalStateException("simulated outage"));
        }
    }
}
