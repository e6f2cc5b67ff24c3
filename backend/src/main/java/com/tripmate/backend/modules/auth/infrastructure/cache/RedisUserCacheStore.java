package com.tripmate.backend.modules.auth.infrastructure.cache;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripmate.backend.global.config.CacheProperties;
import com.tripmate.backend.modules.auth.application.CachedUser;
import com.tripmate.backend.modules.auth.application.UserCacheStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
public class RedisUserCacheStore implements UserCacheStore {

    private static final Logger log = LoggerFactory.getLogger(RedisUserCacheStore.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public RedisUserCacheStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, CacheProperties cacheProperties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = cacheProperties.userTtl();
    }

    @Override
    public void cache(CachedUser user) {
        try {
            String json = objectMapper.writeValueAsString(user);
            redisTemplate.opsForValue().set(idKey(user.id()), json, ttl);
            if (user.email() != null) {
                redisTemplate.opsForValue().set(emailKey(user.email()), json, ttl);
            }
            if (user.profile() != null) {
                redisTemplate.opsForValue().set(profileKey(user.id()), objectMapper.writeValueAsString(user.profile()), ttl);
            }
        } catch (DataAccessException | JsonProcessingException ex) {
            log.warn("Failed to cache user {}: {}", user.id(), ex.getMessage());
        }
    }

    @Override
    public Optional<CachedUser> findById(UUID userId) {
        return read(idKey(userId));
    }

    @Override
    public Optional<CachedUser> findByEmail(String email) {
        return read(emailKey(email));
    }

    @Override
    public void invalidate(UUID userId, String email) {
        List<String> keys = new ArrayList<>();
        keys.add(idKey(userId));
        keys.add(profileKey(userId));
        if (email != null) {
            keys.add(emailKey(email));
        }
        try {
            redisTemplate.delete(keys);
        } catch (DataAccessException ex) {
            log.warn("Failed to invalidate cached user {}: {}", userId, ex.getMessage());
        }
    }

    private Optional<CachedUser> read(String key) {
        try {
            String json = redisTemplate.opsForValue().get(key);
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, CachedUser.class));
        } catch (DataAccessException | JsonProcessingException ex) {
            log.warn("User cache read failed for {}: {}", key, ex.getMessage());
            return Optional.empty();
        }
    }

    private static String idKey(UUID userId) {
        return "user:data:" + userId;
    }

    private static String emailKey(String email) {
        return "user:email:" + email.toLowerCase(Locale.ROOT);
    }

    private static String profileKey(UUID userId) {
        return "profile:" + userId;
    }
}
