package com.tripmate.backend.modules.auth.infrastructure.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripmate.backend.global.cache.CacheUnavailableException;
import com.tripmate.backend.global.cache.TokenDigests;
import com.tripmate.backend.global.config.AuthProperties;
import com.tripmate.backend.modules.auth.application.AccessTokenStore;
import com.tripmate.backend.modules.auth.application.CachedAccessToken;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
public class RedisAccessTokenStore implements AccessTokenStore {

    private static final Logger log = LoggerFactory.getLogger(RedisAccessTokenStore.class);
    private static final String ACCESS_PREFIX = "token:access:";
    private static final String BLACKLIST_PREFIX = "blacklist:";
    private static final String BLACKLISTED = "1";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration accessTokenTtl;

    public RedisAccessTokenStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, AuthProperties authProperties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.accessTokenTtl = authProperties.accessTokenTtl();
    }

    @Override
    public void cache(UUID userId, String rawAccessToken) {
        cache(userId, rawAccessToken, accessTokenTtl);
    }

    @Override
    public void cache(UUID userId, String rawAccessToken, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return;
        }
        String digest = TokenDigests.sha256Hex(rawAccessToken);
        try {
            String json = objectMapper.writeValueAsString(CachedAccessToken.access(userId));
            redisTemplate.opsForValue().set(ACCESS_PREFIX + digest, json, ttl);
        } catch (DataAccessException | JsonProcessingException ex) {
            log.warn("Failed to cache access token {}: {}", TokenDigests.logRef(digest), ex.getMessage());
        }
    }

    @Override
    public Optional<CachedAccessToken> validate(String rawAccessToken) {
        String digest = TokenDigests.sha256Hex(rawAccessToken);
        try {
            String json = redisTemplate.opsForValue().get(ACCESS_PREFIX + digest);
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, CachedAccessToken.class));
        } catch (DataAccessException | JsonProcessingException ex) {
            log.warn("Access token cache read failed for {}, verifying signature: {}",
                    TokenDigests.logRef(digest), ex.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void invalidate(String rawAccessToken) {
        String digest = TokenDigests.sha256Hex(rawAccessToken);
        try {
            redisTemplate.delete(ACCESS_PREFIX + digest);
        } catch (DataAccessException ex) {
            log.warn("Failed to invalidate access token {}: {}", TokenDigests.logRef(digest), ex.getMessage());
        }
    }

    @Override
    public void blacklist(String rawAccessToken, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return;
        }
        String digest = TokenDigests.sha256Hex(rawAccessToken);
        try {
            redisTemplate.opsForValue().set(BLACKLIST_PREFIX + digest, BLACKLISTED, ttl);
            redisTemplate.delete(ACCESS_PREFIX + digest);
        } catch (DataAccessException ex) {
            log.warn("Failed to blacklist access token {}: {}", TokenDigests.logRef(digest), ex.getMessage());
        }
    }

    @Override
    public boolean isBlacklisted(String rawAccessToken) {
        String digest = TokenDigests.sha256Hex(rawAccessToken);
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(BLACKLIST_PREFIX + digest));
        } catch (DataAccessException ex) {
            throw new CacheUnavailableException("Blacklist lookup failed", ex);
        }
    }
}
