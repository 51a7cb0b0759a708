package com.authcore.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import com.authcore.backend.global.store.DuplicateRecordException;
import com.authcore.backend.global.store.RecordNotFoundException;
import com.authcore.backend.global.store.StoreUnavailableException;
import com.authcore.backend.modules.auth.application.CredentialStore;
import com.authcore.backend.modules.auth.application.RefreshTokenStore;
import com.authcore.backend.modules.auth.domain.AppUser;
import com.authcore.backend.modules.auth.domain.RefreshTokenRecord;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * PostgreSQL-backed user and refresh-token records. Spring's {@link DataAccessException}
 * hierarchy is translated into the store exceptions the engine understands.
 */
@Repository
public class JpaCredentialStore implements CredentialStore, RefreshTokenStore {

    private final AppUserRepository appUserRepository;
    private final RefreshTokenRepository refreshTokenRepository;

    public JpaCredentialStore(AppUserRepository appUserRepository, RefreshTokenRepository refreshTokenRepository) {
        this.appUserRepository = appUserRepository;
        this.refreshTokenRepository = refreshTokenRepository;
    }

    @Override
    @Transactional
    public AppUser createUser(AppUser user) {
        try {
            return appUserRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            throw new DuplicateRecordException("user", "email", ex);
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException("create user", ex);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AppUser> findUserByEmail(String normalizedEmail) {
        return read("find user by email", () -> appUserRepository.findByEmail(normalizedEmail));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AppUser> findUserById(UUID userId) {
        return read("find user by id", () -> appUserRepository.findById(userId));
    }

    @Override
    @Transactional
    public void updateLastLogin(UUID userId, OffsetDateTime loggedInAt) {
        int updated = write("update last login", () -> appUserRepository.updateLastLogin(userId, loggedInAt));
        if (updated == 0) {
            throw new RecordNotFoundException("user", userId);
        }
    }

    @Override
    @Transactional
    public RefreshTokenRecord createToken(RefreshTokenRecord record) {
        try {
            return refreshTokenRepository.saveAndFlush(record);
        } catch (DataIntegrityViolationException ex) {
            throw new DuplicateRecordException("refresh token", "token_hash", ex);
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException("create refresh token", ex);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<RefreshTokenRecord> findByDigest(String tokenDigest) {
        return read("find refresh token", () -> refreshTokenRepository.findByTokenHash(tokenDigest));
    }

    @Override
    @Transactional
    public boolean deleteByDigest(String tokenDigest) {
        return write("delete refresh token", () -> refreshTokenRepository.deleteByTokenHash(tokenDigest)) > 0;
    }

    @Override
    @Transactional
    public int deleteExpired(OffsetDateTime now) {
        return write("delete expired refresh tokens", () -> refreshTokenRepository.deleteExpired(now));
    }

    private static <T> Optional<T> read(String operation, Supplier<Optional<T>> query) {
        try {
            return query.get();
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException(operation, ex);
        }
    }

    private static int write(String operation, Supplier<Integer> statement) {
        try {
            return statement.get();
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException(operation, ex);
        }
    }
}
