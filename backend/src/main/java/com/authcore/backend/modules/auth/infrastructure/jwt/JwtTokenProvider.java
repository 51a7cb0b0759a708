package com.authcore.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import com.authcore.backend.global.config.AuthProperties;

import org.springframework.stereotype.Component;

/**
 * Holds the process-wide HMAC signing key. The secret is read once at startup and
 * never changes; its length is checked by {@link AuthProperties.Jwt}.
 */
@Component
public class JwtTokenProvider {

    private static final String HMAC_SHA_256 = "HmacSHA256";

    private final SecretKey secretKey;

    public JwtTokenProvider(AuthProperties properties) {
        byte[] keyBytes = properties.jwt().secret().getBytes(StandardCharsets.UTF_8);
        this.secretKey = new SecretKeySpec(keyBytes, HMAC_SHA_256);
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }
}
