package com.tripmate.backend.modules.permission.infrastructure.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripmate.backend.global.config.CacheProperties;
import com.tripmate.backend.modules.permission.application.CachedPermission;
import com.tripmate.backend.modules.permission.application.PermissionCacheStore;
import com.tripmate.backend.modules.permission.application.PermissionCheck;
import com.tripmate.backend.modules.permission.domain.PermissionObject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.stereotype.Component;

/**
 * Key space: {@code perm:{userId}:{objectType:objectId}:{relation}}.
 */
@Component
public class RedisPermissionCacheStore implements PermissionCacheStore {

    private static final Logger log = LoggerFactory.getLogger(RedisPermissionCacheStore.class);
    private static final long SCAN_COUNT = 500;

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;
    private final Clock clock;

    public RedisPermissionCacheStore(
            StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            CacheProperties cacheProperties,
            Clock clock
    ) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = cacheProperties.permissionTtl();
        this.clock = clock;
    }

    @Override
    public void cache(UUID userId, PermissionObject object, String relation, boolean allowed) {
        try {
            String json = objectMapper.writeValueAsString(new CachedPermission(allowed, OffsetDateTime.now(clock)));
            redisTemplate.opsForValue().set(key(userId, object, relation), json, ttl);
        } catch (DataAccessException | JsonProcessingException ex) {
            log.warn("Failed to cache permission {} on {} for {}: {}", relation, object, userId, ex.getMessage());
        }
    }

    @Override
    public Optional<CachedPermission> get(UUID userId, PermissionObject object, String relation) {
        try {
            String json = redisTemplate.opsForValue().get(key(userId, object, relation));
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, CachedPermission.class));
        } catch (DataAccessException | JsonProcessingException ex) {
            log.warn("Permission cache read failed for {} on {}: {}", userId, object, ex.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void invalidateAllForUser(UUID userId) {
        try {
            List<String> keys = new ArrayList<>();
            ScanOptions options = ScanOptions.scanOptions().match("perm:" + userId + ":*").count(SCAN_COUNT).build();
            try (Cursor<String> cursor = redisTemplate.scan(options)) {
                while (cursor.hasNext()) {
                    keys.add(cursor.next());
                }
            }
            if (!keys.isEmpty()) {
                redisTemplate.delete(keys);
            }
        } catch (DataAccessException ex) {
            log.warn("Failed to invalidate permissions for {}: {}", userId, ex.getMessage());
        }
    }

    @Override
    public void cacheBatch(UUID userId, Map<PermissionCheck, Boolean> results) {
        if (results.isEmpty()) {
            return;
        }
        try {
            OffsetDateTime now = OffsetDateTime.now(clock);
            Map<String, String> values = new LinkedHashMap<>();
            for (Map.Entry<PermissionCheck, Boolean> entry : results.entrySet()) {
                PermissionCheck check = entry.getKey();
                values.put(key(userId, check.object(), check.relation()),
                        objectMapper.writeValueAsString(new CachedPermission(entry.getValue(), now)));
            }
            redisTemplate.executePipelined(new SessionCallback<Object>() {
                @Override
                @SuppressWarnings("unchecked")
                public <K, V> Object execute(RedisOperations<K, V> operations) {
                    ValueOperations<String, String> valueOps = ((RedisOperations<String, String>) operations).opsForValue();
                    values.forEach((key, json) -> valueOps.set(key, json, ttl));
                    return null;
                }
            });
        } catch (DataAccessException | JsonProcessingException ex) {
            log.warn("Failed to cache {} permission results for {}: {}", results.size(), userId, ex.getMessage());
        }
    }

    static String key(UUID userId, PermissionObject object, String relation) {
        return "perm:" + userId + ":" + object + ":" + relation;
    }
}
