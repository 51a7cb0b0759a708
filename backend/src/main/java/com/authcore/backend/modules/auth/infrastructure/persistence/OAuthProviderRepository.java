package com.authcore.backend.modules.auth.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.authcore.backend.modules.auth.domain.OAuthProvider;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OAuthProviderRepository extends JpaRepository<OAuthProvider, UUID> {

    Optional<OAuthProvider> findByProviderAndProviderUserId(String provider, String providerUserId);

    List<OAuthProvider> findByUserIdOrderByCreatedAtAsc(UUID userId);

    @Modifying
    @Query("delete from OAuthProvider op where op.userId = :userId and op.provider = :provider")
    int deleteByUserIdAndProvider(@Param("userId") UUID userId, @Param("provider") String provider);
}
