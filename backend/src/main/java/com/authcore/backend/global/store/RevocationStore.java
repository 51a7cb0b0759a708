package com.authcore.backend.global.store;

import java.time.Duration;
import java.util.OptionalLong;

/**
 * Fast keyed store for ephemeral state: token denylist markers and rate-limit windows.
 * Every operation is atomic on a single key. Failures surface as
 * {@link StoreUnavailableException}.
 */
public interface RevocationStore {

    void setWithTtl(String key, Duration ttl);

    /**
     * Sets the key only if it is absent.
     *
     * @return {@code true} when this call created the key
     */
    boolean setIfAbsentWithTtl(String key, Duration ttl);

    boolean exists(String key);

    void delete(String key);

    void addScored(String key, String member, long score);

    /**
     * Removes every member whose score is less than or equal to {@code maxScore}.
     */
    long removeScoredUpTo(String key, long maxScore);

    /**
     * Counts members whose score is strictly greater than {@code minScore}.
     */
    long countScoredAbove(String key, long minScore);

    OptionalLong oldestScore(String key);

    void expireKey(String key, Duration ttl);
}
