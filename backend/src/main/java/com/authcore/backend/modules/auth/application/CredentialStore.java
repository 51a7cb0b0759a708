package com.authcore.backend.modules.auth.application;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.authcore.backend.global.store.DuplicateRecordException;
import com.authcore.backend.global.store.RecordNotFoundException;
import com.authcore.backend.modules.auth.domain.AppUser;

/**
 * Durable user records. Other failures surface as
 * {@link com.authcore.backend.global.store.StoreUnavailableException}.
 */
public interface CredentialStore {

    /**
     * @throws DuplicateRecordException when the normalized email is taken
     */
    AppUser createUser(AppUser user);

    Optional<AppUser> findUserByEmail(String normalizedEmail);

    Optional<AppUser> findUserById(UUID userId);

    /**
     * @throws RecordNotFoundException when no user has the id
     */
    void updateLastLogin(UUID userId, OffsetDateTime loggedInAt);
}
