package com.authcore.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import com.authcore.backend.modules.auth.application.UserProfile;
import com.fasterxml.jackson.annotation.JsonProperty;

public record UserProfileResponse(
        UUID id,
        String email,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("updated_at") String updatedAt,
        @JsonProperty("last_login_at") String lastLoginAt,
        @JsonProperty("is_email_verified") boolean emailVerified
) {

    public static UserProfileResponse from(UserProfile profile) {
        return new UserProfileResponse(
                profile.id(),
                profile.email(),
                rfc3339(profile.createdAt()),
                rfc3339(profile.updatedAt()),
                rfc3339(profile.lastLoginAt()),
                profile.emailVerified()
        );
    }

    private static String rfc3339(OffsetDateTime value) {
        if (value == null) {
            return null;
        }
        return value.truncatedTo(ChronoUnit.SECONDS).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }
}
