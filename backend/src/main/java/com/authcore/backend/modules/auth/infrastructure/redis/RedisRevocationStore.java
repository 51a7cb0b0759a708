package com.authcore.backend.modules.auth.infrastructure.redis;

import java.time.Duration;
import java.util.OptionalLong;
import java.util.Set;
import java.util.function.Supplier;

import com.authcore.backend.global.store.RevocationStore;
import com.authcore.backend.global.store.StoreUnavailableException;

import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations.TypedTuple;
import org.springframework.stereotype.Component;

/**
 * Redis implementation of {@link RevocationStore}. Plain keys hold denylist markers,
 * sorted sets hold rate-limit windows. Each method maps to a single Redis command.
 */
@Component
public class RedisRevocationStore implements RevocationStore {

    private static final String MARKER = "1";

    private final StringRedisTemplate redis;

    public RedisRevocationStore(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public void setWithTtl(String key, Duration ttl) {
        execute("SET " + key, () -> {
            redis.opsForValue().set(key, MARKER, ttl);
            return null;
        });
    }

    @Override
    public boolean setIfAbsentWithTtl(String key, Duration ttl) {
        return Boolean.TRUE.equals(execute("SETNX " + key, () -> redis.opsForValue().setIfAbsent(key, MARKER, ttl)));
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(execute("EXISTS " + key, () -> redis.hasKey(key)));
    }

    @Override
    public void delete(String key) {
        execute("DEL " + key, () -> redis.delete(key));
    }

    @Override
    public void addScored(String key, String member, long score) {
        execute("ZADD " + key, () -> redis.opsForZSet().add(key, member, score));
    }

    @Override
    public long removeScoredUpTo(String key, long maxScore) {
        Long removed = execute("ZREMRANGEBYSCORE " + key,
                () -> redis.opsForZSet().removeRangeByScore(key, Double.NEGATIVE_INFINITY, maxScore));
        return removed != null ? removed : 0L;
    }

    @Override
    public long countScoredAbove(String key, long minScore) {
        // ZCOUNT bounds are inclusive; step past minScore to make it exclusive
        Long count = execute("ZCOUNT " + key,
                () -> redis.opsForZSet().count(key, Math.nextUp((double) minScore), Double.POSITIVE_INFINITY));
        return count != null ? count : 0L;
    }

    @Override
    public OptionalLong oldestScore(String key) {
        Set<TypedTuple<String>> oldest = execute("ZRANGE " + key,
                () -> redis.opsForZSet().rangeWithScores(key, 0, 0));
        if (oldest == null || oldest.isEmpty()) {
            return OptionalLong.empty();
        }
        Double score = oldest.iterator().next().getScore();
        return score != null ? OptionalLong.of(score.longValue()) : OptionalLong.empty();
    }

    @Override
    public void expireKey(String key, Duration ttl) {
        execute("EXPIRE " + key, () -> redis.expire(key, ttl));
    }

    private static <T> T execute(String operation, Supplier<T> command) {
        try {
            return command.get();
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException(operation, ex);
        }
    }
}
