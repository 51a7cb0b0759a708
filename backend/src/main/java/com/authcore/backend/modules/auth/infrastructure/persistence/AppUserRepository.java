package com.authcore.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.authcore.backend.modules.auth.domain.AppUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AppUserRepository extends JpaRepository<AppUser, UUID> {

    Optional<AppUser> findByEmail(String email);

    @Modifying
    @Query("""
            update AppUser u
               set u.lastLoginAt = :loggedInAt,
                   u.updatedAt = :loggedInAt
             where u.id = :userId
            """)
    int updateLastLogin(@Param("userId") UUID userId, @Param("loggedInAt") OffsetDateTime loggedInAt);
}
