package com.authcore.backend.modules.auth.presentation;

import java.time.Duration;

import com.authcore.backend.global.config.AuthProperties;

import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

/**
 * Builds the HttpOnly cookie that carries the refresh token. Name, path and the Secure flag
 * come from {@code auth.cookie.*}.
 */
@Component
public class RefreshTokenCookies {

    private static final String SAME_SITE = "Strict";

    private final AuthProperties.Cookie settings;

    public RefreshTokenCookies(AuthProperties properties) {
        this.settings = properties.cookie();
    }

    public String name() {
        return settings.name();
    }

    public ResponseCookie issue(String refreshToken, long maxAgeSeconds) {
        return base(refreshToken).maxAge(Duration.ofSeconds(maxAgeSeconds)).build();
    }

    public ResponseCookie clear() {
        return base("").maxAge(Duration.ZERO).build();
    }

    private ResponseCookie.ResponseCookieBuilder base(String value) {
        return ResponseCookie.from(settings.name(), value)
                .httpOnly(true)
                .secure(settings.secure())
                .sameSite(SAME_SITE)
                .path(settings.path());
    }
}
