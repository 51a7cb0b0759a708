package com.authcore.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.authcore.backend.global.store.StoreException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class RefreshTokenSweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(RefreshTokenSweepScheduler.class);

    private final RefreshTokenStore refreshTokenStore;
    private final Clock clock;

    public RefreshTokenSweepScheduler(RefreshTokenStore refreshTokenStore, Clock clock) {
        this.refreshTokenStore = refreshTokenStore;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${auth.refresh-sweep-interval:PT1H}")
    public void sweepExpiredTokens() {
        try {
            int removed = refreshTokenStore.deleteExpired(OffsetDateTime.now(clock));
            if (removed > 0) {
                log.info("Removed {} expired refresh tokens", removed);
            }
        } catch (StoreException ex) {
            log.warn("Expired refresh token sweep failed; retrying on next run", ex);
        }
    }
}
