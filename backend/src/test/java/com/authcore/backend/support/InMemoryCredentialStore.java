package com.authcore.backend.support;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import com.authcore.backend.global.store.DuplicateRecordException;
import com.authcore.backend.global.store.RecordNotFoundException;
import com.authcore.backend.global.store.StoreUnavailableException;
import com.authcore.backend.modules.auth.application.CredentialStore;
import com.authcore.backend.modules.auth.application.RefreshTokenStore;
import com.authcore.backend.modules.auth.domain.AppUser;
import com.authcore.backend.modules.auth.domain.RefreshTokenRecord;

import org.springframework.test.util.ReflectionTestUtils;

/**
 * Map-backed stand-in for the PostgreSQL adapter with switchable failures.
 */
public class InMemoryCredentialStore implements CredentialStore, RefreshTokenStore {

    private final Map<UUID, AppUser> users = new ConcurrentHashMap<>();
    private final Map<String, UUID> userIdsByEmail = new ConcurrentHashMap<>();
    private final Map<String, RefreshTokenRecord> tokensByDigest = new ConcurrentHashMap<>();

    private volatile boolean failReads;
    private volatile boolean failTokenWrites;
    private volatile boolean failTokenDeletes;
    private volatile boolean failLastLoginUpdates;

    @Override
    public AppUser createUser(AppUser user) {
        UUID id = UUID.randomUUID();
        if (userIdsByEmail.putIfAbsent(user.getEmail(), id) != null) {
            throw new DuplicateRecordException("user", "email", null);
        }
        ReflectionTestUtils.setField(user, "id", id);
        users.put(id, user);
        return user;
    }

    @Override
    public Optional<AppUser> findUserByEmail(String normalizedEmail) {
        checkReads();
        UUID id = userIdsByEmail.get(normalizedEmail);
        return id == null ? Optional.empty() : Optional.ofNullable(users.get(id));
    }

    @Override
    public Optional<AppUser> findUserById(UUID userId) {
        checkReads();
        return Optional.ofNullable(users.get(userId));
    }

    @Override
    public void updateLastLogin(UUID userId, OffsetDateTime loggedInAt) {
        if (failLastLoginUpdates) {
            throw new StoreUnavailableException("update last login", new IllegalStateException("simulated"));
        }
        AppUser user = users.get(userId);
        if (user == null) {
            throw new RecordNotFoundException("user", userId);
        }
        user.setLastLoginAt(loggedInAt);
        user.setUpdatedAt(loggedInAt);
    }

    @Override
    public RefreshTokenRecord createToken(RefreshTokenRecord record) {
        if (failTokenWrites) {
            throw new StoreUnavailableException("create refresh token", new IllegalStateException("simulated"));
        }
        if (record.getId() == null) {
            ReflectionTestUtils.setField(record, "id", UUID.randomUUID());
        }
        if (tokensByDigest.putIfAbsent(record.getTokenHash(), record) != null) {
            throw new DuplicateRecordException("refresh token", "token_hash", null);
        }
        return record;
    }

    @Override
    public Optional<RefreshTokenRecord> findByDigest(String tokenDigest) {
        checkReads();
        return Optional.ofNullable(tokensByDigest.get(tokenDigest));
    }

    @Override
    public boolean deleteByDigest(String tokenDigest) {
        if (failTokenDeletes) {
            throw new StoreUnavailableException("delete refresh token", new IllegalStateException("simulated"));
        }
        return tokensByDigest.remove(tokenDigest) != null;
    }

    @Override
    public int deleteExpired(OffsetDateTime now) {
        int before = tokensByDigest.size();
        tokensByDigest.values().removeIf(record -> record.getExpiresAt().isBefore(now));
        return before - tokensByDigest.size();
    }

    public int tokenCount() {
        return tokensByDigest.size();
    }

    public Optional<RefreshTokenRecord> anyTokenOf(UUID userId) {
        return tokensByDigest.values().stream().filter(record -> record.isOwnedBy(userId)).findFirst();
    }

    public void setFailReads(boolean failReads) {
        this.failReads = failReads;
    }

    public void setFailTokenWrites(boolean failTokenWrites) {
        this.failTokenWrites = failTokenWrites;
    }

    public void setFailTokenDeletes(boolean failTokenDeletes) {
        this.failTokenDeletes = failTokenDeletes;
    }

    public void setFailLastLoginUpdates(boolean failLastLoginUpdates) {
        this.failLastLoginUpdates = failLastLoginUpdates;
    }

    private void checkReads() {
        if (failReads) {
            throw new StoreUnavailableException("read", new IllegalStateException("simulated"));
        }
    }
}
