package com.authcore.backend.modules.auth.application;

import java.time.Instant;
import java.util.UUID;

public record AccessClaims(UUID userId, String email, Instant issuedAt, Instant expiresAt) {
}
