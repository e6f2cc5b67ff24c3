package com.tripmate.backend.global.web;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
public class RedisRateLimitCounter implements RateLimitCounter {

    private final StringRedisTemplate redisTemplate;

    public RedisRateLimitCounter(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Window increment(String key, Duration window) {
        Long count = redisTemplate.opsForValue().increment(key);
        long current = count != null ? count : 1L;
        if (current == 1L) {
            redisTemplate.expire(key, window);
        }
        Long ttl = redisTemplate.getExpire(key, TimeUnit.SECONDS);
        // -1 means the key lost its expiry, for instance when EXPIRE failed after INCR
        if (ttl == null || ttl < 0) {
            redisTemplate.expire(key, window);
            ttl = window.toSeconds();
        }
        return new Window(current, ttl);
    }
}
