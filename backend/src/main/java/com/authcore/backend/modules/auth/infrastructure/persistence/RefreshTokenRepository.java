package com.authcore.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.authcore.backend.modules.auth.domain.RefreshTokenRecord;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RefreshTokenRepository extends JpaRepository<RefreshTokenRecord, UUID> {

    Optional<RefreshTokenRecord> findByTokenHash(String tokenHash);

    @Modifying
    @Query("delete from RefreshTokenRecord rt where rt.tokenHash = :tokenHash")
    int deleteByTokenHash(@Param("tokenHash") String tokenHash);

    @Modifying
    @Query("delete from RefreshTokenRecord rt where rt.expiresAt < :now")
    int deleteExpired(@Param("now") OffsetDateTime now);
}
