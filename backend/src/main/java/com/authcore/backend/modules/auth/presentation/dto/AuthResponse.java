package com.authcore.backend.modules.auth.presentation.dto;

import java.util.UUID;

import com.authcore.backend.modules.auth.application.AuthResult;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of a successful register, login or refresh. The refresh token travels only in the cookie.
 */
public record AuthResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("expires_in") long expiresIn,
        UserInfo user
) {

    public static AuthResponse from(AuthResult result) {
        return new AuthResponse(
                result.accessToken(),
                result.tokenType(),
                result.expiresIn(),
                new UserInfo(result.user().id(), result.user().email())
        );
    }

    public record UserInfo(UUID id, String email) {
    }
}
