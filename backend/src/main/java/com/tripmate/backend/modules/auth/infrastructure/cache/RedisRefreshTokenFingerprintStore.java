package com.tripmate.backend.modules.auth.infrastructure.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripmate.backend.global.cache.TokenDigests;
import com.tripmate.backend.global.config.AuthProperties;
import com.tripmate.backend.modules.auth.application.FingerprintMetadata;
import com.tripmate.backend.modules.auth.application.RefreshTokenFingerprintStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Key space: {@code refresh:{userId}:{fingerprint}} holds the metadata JSON and
 * {@code user:refresh:{userId}} is the set of the user's fingerprints. Both live for the
 * refresh-token lifetime.
 */
@Component
public class RedisRefreshTokenFingerprintStore implements RefreshTokenFingerprintStore {

    private static final Logger log = LoggerFactory.getLogger(RedisRefreshTokenFingerprintStore.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String refreshSecret;
    private final Duration ttl;
    private final Clock clock;

    public RedisRefreshTokenFingerprintStore(
            StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            AuthProperties authProperties,
            Clock clock
    ) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.refreshSecret = authProperties.refreshSecret();
        this.ttl = authProperties.refreshTokenTtl();
        this.clock = clock;
    }

    @Override
    public String store(UUID userId, String rawRefreshToken, FingerprintMetadata metadata) {
        String fingerprint = fingerprint(rawRefreshToken);
        FingerprintMetadata value = metadata.withIdentity(userId, fingerprint, OffsetDateTime.now(clock));
        try {
            String json = objectMapper.writeValueAsString(value);
            String setKey = setKey(userId);
            inTransaction(operations -> {
                operations.opsForValue().set(key(userId, fingerprint), json, ttl);
                operations.opsForSet().add(setKey, fingerprint);
                operations.expire(setKey, ttl);
            });
        } catch (DataAccessException | JsonProcessingException ex) {
            log.warn("Failed to cache refresh fingerprint {} for user {}: {}",
                    TokenDigests.logRef(fingerprint), userId, ex.getMessage());
        }
        return fingerprint;
    }

    @Override
    public Optional<FingerprintMetadata> validate(UUID userId, String rawRefreshToken) {
        String fingerprint = fingerprint(rawRefreshToken);
        try {
            String json = redisTemplate.opsForValue().get(key(userId, fingerprint));
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, FingerprintMetadata.class));
        } catch (DataAccessException | JsonProcessingException ex) {
            log.warn("Refresh fingerprint lookup failed for user {}, using durable store: {}", userId, ex.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void remove(UUID userId, String rawRefreshToken) {
        removeByFingerprint(userId, fingerprint(rawRefreshToken));
    }

    @Override
    public boolean removeByFingerprint(UUID userId, String fingerprint) {
        try {
            List<Object> results = inTransaction(operations -> {
                operations.delete(key(userId, fingerprint));
                operations.opsForSet().remove(setKey(userId), fingerprint);
            });
            return anyRemoved(results);
        } catch (DataAccessException ex) {
            log.warn("Failed to remove refresh fingerprint {} for user {}: {}",
                    TokenDigests.logRef(fingerprint), userId, ex.getMessage());
            return false;
        }
    }

    @Override
    public void removeAll(UUID userId) {
        String setKey = setKey(userId);
        try {
            Set<String> fingerprints = redisTemplate.opsForSet().members(setKey);
            List<String> keys = new ArrayList<>();
            if (fingerprints != null) {
                for (String fingerprint : fingerprints) {
                    keys.add(key(userId, fingerprint));
                }
            }
            keys.add(setKey);
            Long removed = redisTemplate.delete(keys);
            log.debug("Removed {} refresh fingerprint keys for user {}", removed, userId);
        } catch (DataAccessException ex) {
            log.warn("Failed to remove refresh fingerprints for user {}: {}", userId, ex.getMessage());
        }
    }

    @Override
    public List<FingerprintMetadata> list(UUID userId) {
        try {
            Set<String> fingerprints = redisTemplate.opsForSet().members(setKey(userId));
            if (fingerprints == null || fingerprints.isEmpty()) {
                return List.of();
            }
            List<String> keys = fingerprints.stream().map(fp -> key(userId, fp)).toList();
            List<String> values = redisTemplate.opsForValue().multiGet(keys);
            if (values == null) {
                return List.of();
            }
            List<FingerprintMetadata> result = new ArrayList<>();
            for (String json : values) {
                // set members can outlive their keyed entry until the set expires
                if (json != null) {
                    result.add(objectMapper.readValue(json, FingerprintMetadata.class));
                }
            }
            return result;
        } catch (DataAccessException | JsonProcessingException ex) {
            log.warn("Failed to list refresh fingerprints for user {}: {}", userId, ex.getMessage());
            return List.of();
        }
    }

    @Override
    public String fingerprint(String rawRefreshToken) {
        return TokenDigests.sha256Hex(rawRefreshToken + refreshSecret);
    }

    /**
     * Runs the commands inside MULTI/EXEC so the keyed entry and the set never drift apart.
     */
    private List<Object> inTransaction(Consumer<RedisOperations<String, String>> commands) {
        return redisTemplate.execute(new SessionCallback<List<Object>>() {
            @Override
            @SuppressWarnings("unchecked")
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) {
                RedisOperations<String, String> stringOperations = (RedisOperations<String, String>) operations;
                stringOperations.multi();
                commands.accept(stringOperations);
                return stringOperations.exec();
            }
        });
    }

    private static boolean anyRemoved(List<Object> results) {
        if (results == null) {
            return false;
        }
        for (Object result : results) {
            if (Boolean.TRUE.equals(result) || (result instanceof Long count && count > 0)) {
                return true;
            }
        }
        return false;
    }

    private static String key(UUID userId, String fingerprint) {
        return "refresh:" + userId + ":" + fingerprint;
    }

    private static String setKey(UUID userId) {
        return "user:refresh:" + userId;
    }
}
