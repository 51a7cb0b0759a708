package com.authcore.backend.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;

import javax.sql.DataSource;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;

@ExtendWith(MockitoExtension.class)
class DependencyHealthCheckerTest {

    @Mock
    private DataSource dataSource;

    @Mock
    private Connection connection;

    @Mock
    private RedisConnectionFactory redisConnectionFactory;

    @Mock
    private RedisConnection redisConnection;

    private DependencyHealthChecker checker;

    @BeforeEach
    void setUp() {
        checker = new DependencyHealthChecker(dataSource, redisConnectionFactory);
    }

    @AfterEach
    void tearDown() {
        checker.destroy();
    }

    @Test
    void passesWhenBothDependenciesAnswer() throws Exception {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.isValid(anyInt())).thenReturn(true);
        when(redisConnectionFactory.getConnection()).thenReturn(redisConnection);
        when(redisConnection.ping()).thenReturn("PONG");

        assertThat(checker.check()).isEmpty();
    }

    @Test
    void reportsEveryFailingDependency() throws Exception {
        when(dataSource.getConnection()).thenThrow(new SQLException("connection refused"));
        when(redisConnectionFactory.getConnection()).thenThrow(new RedisConnectionFailureException("redis down"));

        Optional<String> failure = checker.check();

        assertThat(failure).isPresent();
        assertThat(failure.get())
                .contains("postgres: connection refused")
                .contains("redis: redis down");
    }
}
