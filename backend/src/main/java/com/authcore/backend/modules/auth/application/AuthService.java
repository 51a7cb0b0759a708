package com.authcore.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.authcore.backend.global.error.ErrorCategory;
import com.authcore.backend.global.error.ProblemException;
import com.authcore.backend.global.store.DuplicateRecordException;
import com.authcore.backend.global.store.StoreException;
import com.authcore.backend.modules.auth.application.AuthResult.UserSummary;
import com.authcore.backend.modules.auth.domain.AppUser;
import com.authcore.backend.modules.auth.domain.RefreshTokenRecord;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Credential lifecycle engine: registration, login, refresh-token rotation, logout and
 * access-token validation.
 * <p>
 * Holds no mutable state. Consistency between the durable record store and the denylist is
 * kept by ordering: a refresh token is always denylisted before its record is deleted, so a
 * failure between the two steps leaves the token unusable rather than usable twice.
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    static final String INVALID_CREDENTIALS = "invalid email or password";
    static final String INVALID_REFRESH_TOKEN = "invalid or expired refresh token";
    static final String INVALID_ACCESS_TOKEN = "invalid or expired token";
    static final String EMAIL_TAKEN = "user with this email already exists";

    private final CredentialStore credentialStore;
    private final RefreshTokenStore refreshTokenStore;
    private final TokenDenylistService tokenDenylistService;
    private final TokenCodec tokenCodec;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    public AuthService(
            CredentialStore credentialStore,
            RefreshTokenStore refreshTokenStore,
            TokenDenylistService tokenDenylistService,
            TokenCodec tokenCodec,
            PasswordEncoder passwordEncoder,
            Clock clock
    ) {
        this.credentialStore = credentialStore;
        this.refreshTokenStore = refreshTokenStore;
        this.tokenDenylistService = tokenDenylistService;
        this.tokenCodec = tokenCodec;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
    }

    @Transactional
    public AuthResult register(String email, String password, ClientMetadata metadata) {
        String normalizedEmail = CredentialRules.normalizeEmail(email);
        if (!CredentialRules.isValidEmail(normalizedEmail)) {
            throw new ProblemException(ErrorCategory.INVALID_INPUT, "invalid email format");
        }
        if (!CredentialRules.isValidPassword(password)) {
            throw new ProblemException(ErrorCategory.INVALID_INPUT, CredentialRules.PASSWORD_RULE_MESSAGE);
        }

        AppUser created;
        try {
            if (credentialStore.findUserByEmail(normalizedEmail).isPresent()) {
                throw new ProblemException(ErrorCategory.CONFLICT, EMAIL_TAKEN);
            }
            AppUser user = new AppUser();
            user.setEmail(normalizedEmail);
            user.setPasswordHash(passwordEncoder.encode(password));
            user.setActive(true);
            user.setEmailVerified(false);
            user.stampCreated(OffsetDateTime.now(clock));
            created = credentialStore.createUser(user);
        } catch (DuplicateRecordException ex) {
            // lost a concurrent registration race on the unique index
            throw new ProblemException(ErrorCategory.CONFLICT, EMAIL_TAKEN, ex);
        } catch (StoreException ex) {
            throw unavailable("register", ex);
        }

        log.info("Registered user {}", created.getId());
        return issueTokenPair(created, metadata);
    }

    public AuthResult login(String email, String password, ClientMetadata metadata) {
        String normalizedEmail = CredentialRules.normalizeEmail(email);
        Optional<AppUser> candidate;
        try {
            candidate = credentialStore.findUserByEmail(normalizedEmail);
        } catch (StoreException ex) {
            throw unavailable("login", ex);
        }

        AppUser user = candidate
                .filter(AppUser::isActive)
                .filter(found -> password != null && passwordEncoder.matches(password, found.getPasswordHash()))
                .orElseThrow(() -> new ProblemException(ErrorCategory.UNAUTHORIZED, INVALID_CREDENTIALS));

        recordLogin(user);
        return issueTokenPair(user, metadata);
    }

    public AuthResult refresh(String rawRefreshToken, ClientMetadata metadata) {
        UUID subjectId;
        try {
            subjectId = tokenCodec.verifyRefresh(rawRefreshToken);
        } catch (TokenVerificationException ex) {
            log.debug("Refresh token rejected by codec: {}", ex.getReason());
            throw new ProblemException(ErrorCategory.UNAUTHORIZED, INVALID_REFRESH_TOKEN, ex);
        }

        String digest = TokenDigests.sha256Hex(rawRefreshToken);
        OffsetDateTime now = OffsetDateTime.now(clock);
        AppUser user;
        RefreshTokenRecord record;
        try {
            record = refreshTokenStore.findByDigest(digest)
                    .orElseThrow(() -> new ProblemException(ErrorCategory.UNAUTHORIZED, INVALID_REFRESH_TOKEN));
            if (record.isExpiredAt(now) || !record.isOwnedBy(subjectId)) {
                throw new ProblemException(ErrorCategory.UNAUTHORIZED, INVALID_REFRESH_TOKEN);
            }
            if (tokenDenylistService.isDenied(rawRefreshToken)) {
                log.warn("Denylisted refresh token presented for user {}", record.getUserId());
                throw new ProblemException(ErrorCategory.UNAUTHORIZED, INVALID_REFRESH_TOKEN);
            }
            user = credentialStore.findUserById(record.getUserId())
                    .filter(AppUser::isActive)
                    .orElseThrow(() -> new ProblemException(ErrorCategory.UNAUTHORIZED, INVALID_REFRESH_TOKEN));
        } catch (StoreException ex) {
            throw unavailable("refresh", ex);
        }

        consumeForRotation(rawRefreshToken, record, now);
        return issueTokenPair(user, metadata);
    }

    /**
     * Revokes the presented refresh token when it belongs to {@code userId}. A missing, foreign or
     * already consumed token is not an error.
     */
    public void logout(UUID userId, String rawRefreshToken) {
        if (rawRefreshToken == null || rawRefreshToken.isBlank()) {
            return;
        }
        String digest = TokenDigests.sha256Hex(rawRefreshToken);
        Optional<RefreshTokenRecord> found;
        try {
            found = refreshTokenStore.findByDigest(digest);
        } catch (StoreException ex) {
            throw unavailable("logout", ex);
        }
        if (found.isEmpty() || !found.get().isOwnedBy(userId)) {
            log.debug("Logout for user {} presented no revocable refresh token", userId);
            return;
        }

        RefreshTokenRecord record = found.get();
        OffsetDateTime now = OffsetDateTime.now(clock);
        try {
            tokenDenylistService.deny(rawRefreshToken, remainingLifetime(record, now));
        } catch (StoreException ex) {
            log.warn("Failed to denylist refresh token {} on logout", record.getId(), ex);
        }
        try {
            refreshTokenStore.deleteByDigest(digest);
        } catch (StoreException ex) {
            log.warn("Failed to delete refresh token {} on logout", record.getId(), ex);
        }
        log.info("User {} logged out", userId);
    }

    public AccessClaims validateAccess(String rawAccessToken) {
        if (rawAccessToken == null || rawAccessToken.isBlank()) {
            throw new ProblemException(ErrorCategory.UNAUTHORIZED, INVALID_ACCESS_TOKEN);
        }
        boolean denied;
        try {
            denied = tokenDenylistService.isDenied(rawAccessToken);
        } catch (StoreException ex) {
            throw unavailable("validate token", ex);
        }
        if (denied) {
            throw new ProblemException(ErrorCategory.UNAUTHORIZED, INVALID_ACCESS_TOKEN);
        }
        try {
            return tokenCodec.verifyAccess(rawAccessToken);
        } catch (TokenVerificationException ex) {
            throw new ProblemException(ErrorCategory.UNAUTHORIZED, INVALID_ACCESS_TOKEN, ex);
        }
    }

    public UserProfile getProfile(UUID userId) {
        try {
            return credentialStore.findUserById(userId)
                    .map(UserProfile::from)
                    .orElseThrow(() -> new ProblemException(ErrorCategory.UNAUTHORIZED, INVALID_ACCESS_TOKEN));
        } catch (StoreException ex) {
            throw unavailable("load profile", ex);
        }
    }

    /**
     * Marks the token consumed. Two concurrent rotations of the same token both pass the lookup;
     * the loser is caught either by the SET-NX denylist claim or by the delete reporting no row.
     */
    private void consumeForRotation(String rawRefreshToken, RefreshTokenRecord record, OffsetDateTime now) {
        StoreException denylistFailure = null;
        try {
            if (!tokenDenylistService.deny(rawRefreshToken, remainingLifetime(record, now))) {
                log.warn("Refresh token {} was already claimed by a concurrent rotation", record.getId());
                throw new ProblemException(ErrorCategory.UNAUTHORIZED, INVALID_REFRESH_TOKEN);
            }
        } catch (StoreException ex) {
            denylistFailure = ex;
            log.warn("Failed to denylist refresh token {} during rotation", record.getId(), ex);
        }

        boolean deleted;
        try {
            deleted = refreshTokenStore.deleteByDigest(record.getTokenHash());
        } catch (StoreException ex) {
            if (denylistFailure != null) {
                ex.addSuppressed(denylistFailure);
                throw unavailable("consume refresh token", ex);
            }
            log.warn("Refresh token {} is denylisted but its record could not be deleted", record.getId(), ex);
            return;
        }
        if (!deleted) {
            log.warn("Refresh token {} was already consumed", record.getId());
            throw new ProblemException(ErrorCategory.UNAUTHORIZED, INVALID_REFRESH_TOKEN);
        }
    }

    private AuthResult issueTokenPair(AppUser user, ClientMetadata metadata) {
        ClientMetadata safeMetadata = metadata != null ? metadata : ClientMetadata.none();
        String accessToken = tokenCodec.issueAccess(user.getId(), user.getEmail());
        String refreshToken = tokenCodec.issueRefresh(user.getId());
        Duration refreshTtl = tokenCodec.getRefreshTokenTtl();

        OffsetDateTime now = OffsetDateTime.now(clock);
        RefreshTokenRecord record = new RefreshTokenRecord();
        record.setUserId(user.getId());
        record.setTokenHash(TokenDigests.sha256Hex(refreshToken));
        record.setCreatedAt(now);
        record.setExpiresAt(now.plus(refreshTtl));
        record.setDeviceInfo(safeMetadata.deviceInfo());
        record.setIpAddress(safeMetadata.ipAddress());
        try {
            refreshTokenStore.createToken(record);
        } catch (StoreException ex) {
            throw unavailable("persist refresh token", ex);
        }

        return new AuthResult(
                accessToken,
                AuthResult.BEARER,
                tokenCodec.getAccessTokenTtl().toSeconds(),
                refreshToken,
                refreshTtl.toSeconds(),
                new UserSummary(user.getId(), user.getEmail())
        );
    }

    private void recordLogin(AppUser user) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        try {
            credentialStore.updateLastLogin(user.getId(), now);
            user.setLastLoginAt(now);
        } catch (StoreException ex) {
            log.warn("Failed to update last login for user {}", user.getId(), ex);
        }
    }

    private static Duration remainingLifetime(RefreshTokenRecord record, OffsetDateTime now) {
        return Duration.between(now, record.getExpiresAt());
    }

    private static ProblemException unavailable(String operation, StoreException cause) {
        log.error("Store failure during {}: {}", operation, cause.getMessage());
        return new ProblemException(ErrorCategory.UNAVAILABLE, "service temporarily unavailable", cause);
    }
}
