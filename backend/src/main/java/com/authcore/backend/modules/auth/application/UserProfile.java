package com.authcore.backend.modules.auth.application;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.authcore.backend.modules.auth.domain.AppUser;

/**
 * Sanitized user view: everything except the password hash.
 */
public record UserProfile(
        UUID id,
        String email,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        OffsetDateTime lastLoginAt,
        boolean emailVerified
) {

    public static UserProfile from(AppUser user) {
        return new UserProfile(
                user.getId(),
                user.getEmail(),
                user.getCreatedAt(),
                user.getUpdatedAt(),
                user.getLastLoginAt(),
                user.isEmailVerified()
        );
    }
}
