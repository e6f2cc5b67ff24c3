package com.tripmate.backend.modules.auth.application;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import com.tripmate.backend.global.cache.ResourceLockService;
import com.tripmate.backend.global.cache.ResourceLockService.ResourceLock;
import com.tripmate.backend.modules.auth.infrastructure.persistence.RefreshTokenRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RefreshTokenCleanupJobTest {

    private static final Instant NOW = Instant.parse("2025-02-01T03:00:00Z");

    @Mock
    private RefreshTokenRepository refreshTokenRepository;

    @Mock
    private ResourceLockService resourceLockService;

    private RefreshTokenCleanupJob job;

    @BeforeEach
    void setUp() {
        job = new RefreshTokenCleanupJob(refreshTokenRepository, resourceLockService, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void purgesRowsOlderThanNowAndReleasesTheLock() {
        ResourceLock lock = mock(ResourceLock.class);
        when(resourceLockService.tryAcquire(eq(RefreshTokenCleanupJob.LOCK_RESOURCE), any())).thenReturn(Optional.of(lock));
        when(refreshTokenRepository.deleteExpiredOrRevoked(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC))).thenReturn(4);

        job.purgeExpiredOrRevoked();

        verify(refreshTokenRepository).deleteExpiredOrRevoked(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
        verify(lock).close();
    }

    @Test
    void skipsRoundWhenAnotherInstanceHoldsTheLock() {
        when(resourceLockService.tryAcquire(eq(RefreshTokenCleanupJob.LOCK_RESOURCE), any())).thenReturn(Optional.empty());

        job.purgeExpiredOrRevoked();

        verify(refreshTokenRepository, never()).deleteExpiredOrRevoked(any());
    }
}
