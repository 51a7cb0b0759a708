package com.authcore.backend.modules.auth.application;

import java.time.Duration;

import com.authcore.backend.global.store.RevocationStore;

import org.springframework.stereotype.Service;

/**
 * Denylist of raw token strings. A present marker makes a token invalid regardless of
 * its signature; the marker expires together with the token it denies.
 */
@Service
public class TokenDenylistService {

    static final String KEY_PREFIX = "blacklist:token:";
    private static final Duration MIN_TTL = Duration.ofSeconds(1);

    private final RevocationStore revocationStore;

    public TokenDenylistService(RevocationStore revocationStore) {
        this.revocationStore = revocationStore;
    }

    /**
     * Adds the token to the denylist.
     *
     * @return {@code true} if this call added the marker, {@code false} if it was already denylisted
     */
    public boolean deny(String rawToken, Duration remainingLifetime) {
        return revocationStore.setIfAbsentWithTtl(key(rawToken), ttl(remainingLifetime));
    }

    public boolean isDenied(String rawToken) {
        return revocationStore.exists(key(rawToken));
    }

    private static Duration ttl(Duration remainingLifetime) {
        if (remainingLifetime == null || remainingLifetime.compareTo(MIN_TTL) < 0) {
            return MIN_TTL;
        }
        return remainingLifetime;
    }

    private static String key(String rawToken) {
        return KEY_PREFIX + rawToken;
    }
}
