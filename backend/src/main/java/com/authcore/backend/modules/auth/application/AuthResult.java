package com.authcore.backend.modules.auth.application;

import java.util.UUID;

/**
 * Outcome of a successful register, login or rotation. The refresh token is meant for
 * an HttpOnly cookie, everything else for the response body.
 */
public record AuthResult(
        String accessToken,
        String tokenType,
        long expiresIn,
        String refreshToken,
        long refreshExpiresIn,
        UserSummary user
) {

    public static final String BEARER = "Bearer";

    public record UserSummary(UUID id, String email) {
    }
}
