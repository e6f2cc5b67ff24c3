package com.tripmate.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;

import com.tripmate.backend.global.cache.ResourceLockService;
import com.tripmate.backend.global.cache.ResourceLockService.ResourceLock;
import com.tripmate.backend.modules.auth.infrastructure.persistence.RefreshTokenRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class RefreshTokenCleanupJob {

    private static final Logger log = LoggerFactory.getLogger(RefreshTokenCleanupJob.class);

    static final String LOCK_RESOURCE = "refresh-token-cleanup";
    private static final Duration LOCK_TTL = Duration.ofMinutes(10);

    private final RefreshTokenRepository refreshTokenRepository;
    private final ResourceLockService resourceLockService;
    private final Clock clock;

    public RefreshTokenCleanupJob(
            RefreshTokenRepository refreshTokenRepository,
            ResourceLockService resourceLockService,
            Clock clock
    ) {
        this.refreshTokenRepository = refreshTokenRepository;
        this.resourceLockService = resourceLockService;
        this.clock = clock;
    }

    /**
     * Runs on one instance at a time; the others skip the round while the lock is held.
     */
    @Scheduled(fixedDelayString = "${app.jobs.refresh-token-cleanup-interval:PT1H}")
    @Transactional
    public void purgeExpiredOrRevoked() {
        Optional<ResourceLock> lock = resourceLockService.tryAcquire(LOCK_RESOURCE, LOCK_TTL);
        if (lock.isEmpty()) {
            log.debug("Refresh token cleanup already running elsewhere, skipping");
            return;
        }
        try (ResourceLock held = lock.get()) {
            int deleted = refreshTokenRepository.deleteExpiredOrRevoked(OffsetDateTime.now(clock));
            if (deleted > 0) {
                log.info("Deleted {} expired or revoked refresh tokens", deleted);
            }
        }
    }
}
