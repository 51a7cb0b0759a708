package com.authcore.backend.modules.auth.application;

import java.time.OffsetDateTime;
import java.util.Optional;

import com.authcore.backend.global.store.DuplicateRecordException;
import com.authcore.backend.modules.auth.domain.RefreshTokenRecord;

/**
 * Durable refresh-token records keyed by token digest.
 */
public interface RefreshTokenStore {

    /**
     * @throws DuplicateRecordException when the digest is already stored
     */
    RefreshTokenRecord createToken(RefreshTokenRecord record);

    Optional<RefreshTokenRecord> findByDigest(String tokenDigest);

    /**
     * Compare-and-delete on the digest.
     *
     * @return {@code true} if this call removed the row, {@code false} if it was already gone
     */
    boolean deleteByDigest(String tokenDigest);

    /**
     * @return number of rows removed
     */
    int deleteExpired(OffsetDateTime now);
}
