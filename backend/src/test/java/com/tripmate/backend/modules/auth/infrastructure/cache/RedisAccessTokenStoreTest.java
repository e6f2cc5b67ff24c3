package com.tripmate.backend.modules.auth.infrastructure.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.UUID;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripmate.backend.global.cache.CacheUnavailableException;
import com.tripmate.backend.global.cache.TokenDigests;
import com.tripmate.backend.modules.auth.application.CachedAccessToken;
import com.tripmate.backend.support.TestAuthProperties;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

@ExtendWith(MockitoExtension.class)
class RedisAccessTokenStoreTest {

    private static final String TOKEN = "access.jwt.value";
    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000007");

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RedisAccessTokenStore store;
    private String digest;

    @BeforeEach
    void setUp() {
        store = new RedisAccessTokenStore(redisTemplate, objectMapper, TestAuthProperties.defaults());
        digest = TokenDigests.sha256Hex(TOKEN);
    }

    @Test
    void cachesUnderDigestForAccessLifetime() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        store.cache(USER_ID, TOKEN);

        verify(valueOperations).set(eq("token:access:" + digest), anyString(), eq(Duration.ofDays(1)));
    }

    @Test
    void validateParsesCachedEntry() throws Exception {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("token:access:" + digest))
                .thenReturn(objectMapper.writeValueAsString(CachedAccessToken.access(USER_ID)));

        assertThat(store.validate(TOKEN)).contains(new CachedAccessToken(USER_ID, "access"));
    }

    @Test
    void validateTreatsReadFailureAsMiss() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("down"));

        assertThat(store.validate(TOKEN)).isEmpty();
    }

    @Test
    void blacklistStoresMarkerForRemainingLifetime() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        store.blacklist(TOKEN, Duration.ofMinutes(30));

        verify(valueOperations).set("blacklist:" + digest, "1", Duration.ofMinutes(30));
        verify(redisTemplate).delete("token:access:" + digest);
    }

    @Test
    void blacklistIgnoresNonPositiveTtl() {
        store.blacklist(TOKEN, Duration.ZERO);
        store.blacklist(TOKEN, Duration.ofSeconds(-5));

        verifyNoInteractions(redisTemplate);
    }

    @Test
    void blacklistLookupFailureIsNotAMiss() {
        when(redisTemplate.hasKey("blacklist:" + digest)).thenThrow(new RedisConnectionFailureException("down"));

        assertThatThrownBy(() -> store.isBlacklisted(TOKEN)).isInstanceOf(CacheUnavailableException.class);
    }

    @Test
    void blacklistLookupReportsPresence() {
        when(redisTemplate.hasKey("blacklist:" + digest)).thenReturn(true, false);

        assertThat(store.isBlacklisted(TOKEN)).isTrue();
        assertThat(store.isBlacklisted(TOKEN)).isFalse();
    }
}
