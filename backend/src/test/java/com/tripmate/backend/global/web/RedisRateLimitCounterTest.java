package com.tripmate.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

@ExtendWith(MockitoExtension.class)
class RedisRateLimitCounterTest {

    private static final String KEY = "rate_limit:10.0.0.1:/api/auth/login";
    private static final Duration WINDOW = Duration.ofMinutes(15);

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisRateLimitCounter counter;

    @BeforeEach
    void setUp() {
        counter = new RedisRateLimitCounter(redisTemplate);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    }

    @Test
    void firstHitOpensTheWindow() {
        when(valueOperations.increment(KEY)).thenReturn(1L);
        when(redisTemplate.getExpire(KEY, TimeUnit.SECONDS)).thenReturn(900L);

        RateLimitCounter.Window window = counter.increment(KEY, WINDOW);

        assertThat(window.count()).isEqualTo(1);
        assertThat(window.resetSeconds()).isEqualTo(900);
        verify(redisTemplate).expire(KEY, WINDOW);
    }

    @Test
    void laterHitsKeepTheExistingExpiry() {
        when(valueOperations.increment(KEY)).thenReturn(4L);
        when(redisTemplate.getExpire(KEY, TimeUnit.SECONDS)).thenReturn(120L);

        RateLimitCounter.Window window = counter.increment(KEY, WINDOW);

        assertThat(window.count()).isEqualTo(4);
        assertThat(window.resetSeconds()).isEqualTo(120);
        verify(redisTemplate, never()).expire(KEY, WINDOW);
    }

    @Test
    void keyWithoutExpiryIsGivenOneAgain() {
        when(valueOperations.increment(KEY)).thenReturn(7L);
        when(redisTemplate.getExpire(KEY, TimeUnit.SECONDS)).thenReturn(-1L);

        RateLimitCounter.Window window = counter.increment(KEY, WINDOW);

        assertThat(window.resetSeconds()).isEqualTo(WINDOW.toSeconds());
        verify(redisTemplate).expire(KEY, WINDOW);
    }
}
