package com.authcore.backend.health;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.stereotype.Component;

/**
 * Pings PostgreSQL and Redis in parallel under one shared deadline and reports every
 * failure, not only the first.
 */
@Component
public class DependencyHealthChecker implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(DependencyHealthChecker.class);

    static final Duration CHECK_TIMEOUT = Duration.ofSeconds(2);

    private final DataSource dataSource;
    private final RedisConnectionFactory redisConnectionFactory;
    private final ExecutorService executor;

    public DependencyHealthChecker(DataSource dataSource, RedisConnectionFactory redisConnectionFactory) {
        this.dataSource = dataSource;
        this.redisConnectionFactory = redisConnectionFactory;
        this.executor = Executors.newFixedThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "health-check");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * @return the joined failure description, or empty when every dependency answered in time
     */
    public Optional<String> check() {
        Map<String, CompletableFuture<Void>> probes = new LinkedHashMap<>();
        probes.put("postgres", CompletableFuture.runAsync(this::pingPostgres, executor));
        probes.put("redis", CompletableFuture.runAsync(this::pingRedis, executor));

        long deadline = System.nanoTime() + CHECK_TIMEOUT.toNanos();
        List<String> failures = new ArrayList<>();
        for (Map.Entry<String, CompletableFuture<Void>> probe : probes.entrySet()) {
            String name = probe.getKey();
            try {
                probe.getValue().get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (TimeoutException ex) {
                probe.getValue().cancel(true);
                failures.add(name + ": ping timed out after " + CHECK_TIMEOUT.toMillis() + "ms");
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                failures.add(name + ": " + cause.getMessage());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                failures.add(name + ": health check interrupted");
            }
        }

        if (failures.isEmpty()) {
            return Optional.empty();
        }
        String joined = String.join("\n", failures);
        log.warn("Dependency health check failed: {}", joined.replace('\n', ';'));
        return Optional.of(joined);
    }

    private void pingPostgres() {
        try (Connection connection = dataSource.getConnection()) {
            if (!connection.isValid((int) CHECK_TIMEOUT.toSeconds())) {
                throw new IllegalStateException("connection is not valid");
            }
        } catch (SQLException ex) {
            throw new IllegalStateException(ex.getMessage(), ex);
        }
    }

    private void pingRedis() {
        try (RedisConnection connection = redisConnectionFactory.getConnection()) {
            connection.ping();
        }
    }

    @Override
    public void destroy() {
        executor.shutdownNow();
    }
}
