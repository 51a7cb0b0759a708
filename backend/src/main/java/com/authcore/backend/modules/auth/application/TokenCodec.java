package com.authcore.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

import javax.crypto.SecretKey;

import com.authcore.backend.global.config.AuthProperties;
import com.authcore.backend.modules.auth.application.TokenVerificationException.Reason;
import com.authcore.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.SecurityException;
import io.jsonwebtoken.security.SignatureException;
import org.springframework.stereotype.Component;

/**
 * Signs and verifies HS256 JWTs.
 * <p>
 * Access tokens carry {@code sub}, {@code email}, {@code iat} and {@code exp}. Refresh tokens carry
 * {@code sub}, {@code iat}, {@code exp}, {@code jti} and {@code type=refresh}; the {@code jti} keeps
 * two refresh tokens issued in the same second distinct. Pure functions of the key and the clock.
 */
@Component
public class TokenCodec {

    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_TYPE = "type";
    static final String TYPE_REFRESH = "refresh";

    private final SecretKey secretKey;
    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;
    private final Clock clock;
    private final JwtParser parser;

    public TokenCodec(JwtTokenProvider tokenProvider, AuthProperties properties, Clock clock) {
        this.secretKey = tokenProvider.getSecretKey();
        this.accessTokenTtl = properties.jwt().accessTokenTtl();
        this.refreshTokenTtl = properties.jwt().refreshTokenTtl();
        this.clock = clock;
        this.parser = Jwts.parser()
                .verifyWith(secretKey)
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    public String issueAccess(UUID subjectId, String email) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(subjectId.toString())
                .claim(CLAIM_EMAIL, email)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(accessTokenTtl)))
                .signWith(secretKey, SIG.HS256)
                .compact();
    }

    public String issueRefresh(UUID subjectId) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(subjectId.toString())
                .id(UUID.randomUUID().toString())
                .claim(CLAIM_TYPE, TYPE_REFRESH)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(refreshTokenTtl)))
                .signWith(secretKey, SIG.HS256)
                .compact();
    }

    public AccessClaims verifyAccess(String token) {
        Claims claims = parse(token);
        UUID subjectId = subject(claims);
        Object email = claims.get(CLAIM_EMAIL);
        if (!(email instanceof String emailValue) || emailValue.isBlank()) {
            throw new TokenVerificationException(Reason.MALFORMED, "email claim is missing");
        }
        if (claims.getIssuedAt() == null || claims.getExpiration() == null) {
            throw new TokenVerificationException(Reason.MALFORMED, "iat/exp claims are missing");
        }
        return new AccessClaims(
                subjectId,
                emailValue,
                claims.getIssuedAt().toInstant(),
                claims.getExpiration().toInstant()
        );
    }

    public UUID verifyRefresh(String token) {
        Claims claims = parse(token);
        if (!TYPE_REFRESH.equals(claims.get(CLAIM_TYPE))) {
            throw new TokenVerificationException(Reason.WRONG_TYPE, "not a refresh token");
        }
        if (claims.getExpiration() == null) {
            throw new TokenVerificationException(Reason.MALFORMED, "exp claim is missing");
        }
        return subject(claims);
    }

    public Duration getAccessTokenTtl() {
        return accessTokenTtl;
    }

    public Duration getRefreshTokenTtl() {
        return refreshTokenTtl;
    }

    private Claims parse(String token) {
        if (token == null || token.isBlank()) {
            throw new TokenVerificationException(Reason.MALFORMED, "token is empty");
        }
        try {
            Jws<Claims> jws = parser.parseSignedClaims(token);
            // a valid MAC under another HMAC variant is still algorithm substitution
            if (!SIG.HS256.getId().equals(jws.getHeader().getAlgorithm())) {
                throw new TokenVerificationException(Reason.UNSUPPORTED_ALGORITHM,
                        "unexpected signing algorithm " + jws.getHeader().getAlgorithm());
            }
            return jws.getPayload();
        } catch (ExpiredJwtException ex) {
            throw new TokenVerificationException(Reason.EXPIRED, "token is expired", ex);
        } catch (SignatureException ex) {
            throw new TokenVerificationException(Reason.INVALID_SIGNATURE, "token signature is invalid", ex);
        } catch (UnsupportedJwtException | SecurityException ex) {
            throw new TokenVerificationException(Reason.UNSUPPORTED_ALGORITHM, "token algorithm is not accepted", ex);
        } catch (JwtException | IllegalArgumentException ex) {
            throw new TokenVerificationException(Reason.MALFORMED, "token is malformed", ex);
        }
    }

    private UUID subject(Claims claims) {
        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new TokenVerificationException(Reason.MALFORMED, "sub claim is missing");
        }
        try {
            return UUID.fromString(subject);
        } catch (IllegalArgumentException ex) {
            throw new TokenVerificationException(Reason.MALFORMED, "sub claim is not a user id", ex);
        }
    }
}
