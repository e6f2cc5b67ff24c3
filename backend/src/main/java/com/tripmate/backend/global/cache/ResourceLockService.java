package com.tripmate.backend.global.cache;

import java.time.Duration;
import java.util.Collections;
import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;

/**
 * Short-lived mutual exclusion on {@code lock:{resource}} keys.
 */
@Service
public class ResourceLockService {

    private static final Logger log = LoggerFactory.getLogger(ResourceLockService.class);
    private static final String KEY_PREFIX = "lock:";

    // Deletes the key only while it still holds the caller's owner value.
    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class
    );

    private final StringRedisTemplate redisTemplate;

    public ResourceLockService(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the held lock, or empty when another owner holds it or Redis is unreachable
     */
    public Optional<ResourceLock> tryAcquire(String resource, Duration ttl) {
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("resource must not be blank");
        }
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        String key = KEY_PREFIX + resource;
        String owner = UUID.randomUUID().toString();
        try {
            Boolean acquired = redisTemplate.opsForValue().setIfAbsent(key, owner, ttl);
            if (Boolean.TRUE.equals(acquired)) {
                return Optional.of(new ResourceLock(key, owner));
            }
            return Optional.empty();
        } catch (DataAccessException ex) {
            log.warn("Could not acquire lock {}: {}", key, ex.getMessage());
            return Optional.empty();
        }
    }

    public final class ResourceLock implements AutoCloseable {

        private final String key;
        private final String owner;

        private ResourceLock(String key, String owner) {
            this.key = key;
            this.owner = owner;
        }

        public String key() {
            return key;
        }

        /**
         * @return true when this owner still held the lock and removed it
         */
        public boolean release() {
            try {
                Long removed = redisTemplate.execute(RELEASE_SCRIPT, Collections.singletonList(key), owner);
                return removed != null && removed > 0;
            } catch (DataAccessException ex) {
                log.warn("Could not release lock {}: {}", key, ex.getMessage());
                return false;
            }
        }

        @Override
        public void close() {
            release();
        }
    }
}
