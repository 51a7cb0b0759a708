package com.authcore.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;

import com.authcore.backend.support.InMemoryRevocationStore;
import com.authcore.backend.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TokenDenylistServiceTest {

    private MutableClock clock;
    private InMemoryRevocationStore store;
    private TokenDenylistService denylist;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T09:00:00Z"));
        store = new InMemoryRevocationStore(clock);
        denylist = new TokenDenylistService(store);
    }

    @Test
    void secondDenyOfSameTokenReportsLostClaim() {
        assertThat(denylist.deny("token-a", Duration.ofMinutes(5))).isTrue();
        assertThat(denylist.deny("token-a", Duration.ofMinutes(5))).isFalse();
        assertThat(denylist.isDenied("token-a")).isTrue();
        assertThat(denylist.isDenied("token-b")).isFalse();
    }

    @Test
    void entryExpiresWithTheToken() {
        denylist.deny("token-a", Duration.ofMinutes(5));

        clock.advance(Duration.ofMinutes(5));

        assertThat(denylist.isDenied("token-a")).isFalse();
    }

    @Test
    void nonPositiveLifetimeStillDeniesForOneSecond() {
        denylist.deny("token-a", Duration.ofSeconds(-30));

        assertThat(store.ttlOf(TokenDenylistService.KEY_PREFIX + "token-a")).isEqualTo(Duration.ofSeconds(1));
        assertThat(denylist.isDenied("token-a")).isTrue();
    }
}
