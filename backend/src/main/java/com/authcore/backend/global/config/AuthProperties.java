package com.authcore.backend.global.config;

import java.time.Duration;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Immutable process configuration for the credential lifecycle.
 * Bound once at startup; every component receives it by injection.
 * Invalid values fail the binding and therefore the application start.
 */
@ConfigurationProperties(prefix = "auth")
public record AuthProperties(
        @DefaultValue Jwt jwt,
        @DefaultValue Security security,
        @DefaultValue RateLimit rateLimit,
        @DefaultValue Cookie cookie,
        @DefaultValue("PT1H") Duration refreshSweepInterval,
        @DefaultValue Cors cors
) {

    public static final int MIN_SECRET_LENGTH = 32;

    public record Jwt(
            String secret,
            @DefaultValue("15m") Duration accessTokenTtl,
            @DefaultValue("7d") Duration refreshTokenTtl
    ) {
        public Jwt {
            if (secret == null || secret.length() < MIN_SECRET_LENGTH) {
                throw new IllegalArgumentException(
                        "auth.jwt.secret must be at least " + MIN_SECRET_LENGTH + " characters long");
            }
            requirePositive(accessTokenTtl, "auth.jwt.access-token-ttl");
            requirePositive(refreshTokenTtl, "auth.jwt.refresh-token-ttl");
        }
    }

    public record Security(@DefaultValue("12") int bcryptCost) {
        public Security {
            // BCrypt log rounds are limited to 4..31
            if (bcryptCost < 4 || bcryptCost > 31) {
                throw new IllegalArgumentException("auth.security.bcrypt-cost must be between 4 and 31");
            }
        }
    }

    public record RateLimit(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("10") int requests,
            @DefaultValue("1m") Duration window,
            @DefaultValue("false") boolean trustForwardedHeaders,
            @DefaultValue("true") boolean failOpen
    ) {
        public RateLimit {
            if (requests < 1) {
                throw new IllegalArgumentException("auth.rate-limit.requests must be >= 1");
            }
            requirePositive(window, "auth.rate-limit.window");
        }
    }

    public record Cookie(
            @DefaultValue("refresh_token") String name,
            @DefaultValue("/api/v1/auth/refresh") String path,
            @DefaultValue("true") boolean secure
    ) {
    }

    public record Cors(@DefaultValue("http://localhost:3000") List<String> allowedOrigins) {
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }
}
