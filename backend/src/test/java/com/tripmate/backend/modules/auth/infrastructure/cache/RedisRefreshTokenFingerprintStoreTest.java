package com.tripmate.backend.modules.auth.infrastructure.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripmate.backend.global.cache.TokenDigests;
import com.tripmate.backend.modules.auth.application.FingerprintMetadata;
import com.tripmate.backend.modules.auth.application.SessionContext;
import com.tripmate.backend.support.TestAuthProperties;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

@ExtendWith(MockitoExtension.class)
class RedisRefreshTokenFingerprintStoreTest {

    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000042");
    private static final String RAW_TOKEN = "refresh.jwt.value";

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @Mock
    private SetOperations<String, String> setOperations;

    @Mock
    private RedisOperations<String, String> operations;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private RedisRefreshTokenFingerprintStore store;
    private String fingerprint;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);
        store = new RedisRefreshTokenFingerprintStore(redisTemplate, objectMapper, TestAuthProperties.defaults(), clock);
        fingerprint = TokenDigests.sha256Hex(RAW_TOKEN + TestAuthProperties.REFRESH_SECRET);
    }

    @Test
    void storeWritesKeyedEntryAndSetMembershipInOneTransaction() throws Exception {
        runTransactionsAgainst(operations);
        when(operations.opsForValue()).thenReturn(valueOperations);
        when(operations.opsForSet()).thenReturn(setOperations);

        String stored = store.store(USER_ID, RAW_TOKEN, FingerprintMetadata.forRegistration(new SessionContext("JUnit", "10.0.0.1")));

        assertThat(stored).isEqualTo(fingerprint).hasSize(64);
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        InOrder inOrder = inOrder(operations, valueOperations, setOperations);
        inOrder.verify(operations).multi();
        inOrder.verify(valueOperations).set(eq("refresh:" + USER_ID + ":" + fingerprint), json.capture(), eq(Duration.ofDays(7)));
        inOrder.verify(setOperations).add("user:refresh:" + USER_ID, fingerprint);
        inOrder.verify(operations).expire("user:refresh:" + USER_ID, Duration.ofDays(7));
        inOrder.verify(operations).exec();

        FingerprintMetadata written = objectMapper.readValue(json.getValue(), FingerprintMetadata.class);
        assertThat(written.userId()).isEqualTo(USER_ID);
        assertThat(written.userAgent()).isEqualTo("JUnit");
        assertThat(written.restored()).isFalse();
        assertThat(json.getValue()).doesNotContain(RAW_TOKEN);
    }

    @Test
    @SuppressWarnings("unchecked")
    void storeFailureStillReturnsFingerprint() {
        when(redisTemplate.execute(any(SessionCallback.class))).thenThrow(new RedisConnectionFailureException("down"));

        assertThat(store.store(USER_ID, RAW_TOKEN, FingerprintMetadata.restoredFromDurableStore())).isEqualTo(fingerprint);
    }

    @Test
    void validateReturnsEmptyOnMissAndOnBackendFailure() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(anyString()))
                .thenReturn(null)
                .thenThrow(new RedisConnectionFailureException("down"));

        assertThat(store.validate(USER_ID, RAW_TOKEN)).isEmpty();
        assertThat(store.validate(USER_ID, RAW_TOKEN)).isEmpty();
    }

    @Test
    void validateReturnsStoredMetadata() throws Exception {
        FingerprintMetadata metadata = FingerprintMetadata.restoredFromDurableStore()
                .withIdentity(USER_ID, fingerprint, OffsetDateTime.parse("2025-01-01T00:00:00Z"));
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("refresh:" + USER_ID + ":" + fingerprint)).thenReturn(objectMapper.writeValueAsString(metadata));

        Optional<FingerprintMetadata> result = store.validate(USER_ID, RAW_TOKEN);

        assertThat(result).isPresent();
        assertThat(result.get().restored()).isTrue();
    }

    @Test
    void removeDeletesEntryAndSetMembershipInOneTransaction() {
        runTransactionsAgainst(operations);
        when(operations.opsForSet()).thenReturn(setOperations);
        when(operations.exec()).thenReturn(List.of(true, 1L));

        store.remove(USER_ID, RAW_TOKEN);

        InOrder inOrder = inOrder(operations, setOperations);
        inOrder.verify(operations).multi();
        inOrder.verify(operations).delete("refresh:" + USER_ID + ":" + fingerprint);
        inOrder.verify(setOperations).remove("user:refresh:" + USER_ID, fingerprint);
        inOrder.verify(operations).exec();
    }

    @Test
    void removeByFingerprintReportsWhetherAnythingExisted() {
        runTransactionsAgainst(operations);
        when(operations.opsForSet()).thenReturn(setOperations);
        when(operations.exec())
                .thenReturn(List.of(false, 1L))
                .thenReturn(List.of(false, 0L));

        assertThat(store.removeByFingerprint(USER_ID, "fp1")).isTrue();
        assertThat(store.removeByFingerprint(USER_ID, "fp1")).isFalse();
    }

    @Test
    @SuppressWarnings("unchecked")
    void removeByFingerprintTreatsBackendFailureAsNothingRemoved() {
        when(redisTemplate.execute(any(SessionCallback.class))).thenThrow(new RedisConnectionFailureException("down"));

        assertThat(store.removeByFingerprint(USER_ID, "fp1")).isFalse();
    }

    @Test
    @SuppressWarnings("unchecked")
    void removeAllDeletesEveryKeyAndTheSetInOneCommand() {
        when(redisTemplate.opsForSet()).thenReturn(setOperations);
        when(setOperations.members("user:refresh:" + USER_ID)).thenReturn(new LinkedHashSet<>(List.of("fp1", "fp2")));

        store.removeAll(USER_ID);

        ArgumentCaptor<Collection<String>> keys = ArgumentCaptor.forClass(Collection.class);
        verify(redisTemplate).delete(keys.capture());
        assertThat(keys.getValue()).containsExactlyInAnyOrder(
                "refresh:" + USER_ID + ":fp1",
                "refresh:" + USER_ID + ":fp2",
                "user:refresh:" + USER_ID
        );
    }

    @Test
    void listSkipsMembersWhoseEntryExpired() throws Exception {
        FingerprintMetadata live = FingerprintMetadata.forLogin(SessionContext.unknown(), OffsetDateTime.parse("2025-01-01T00:00:00Z"))
                .withIdentity(USER_ID, "fp1", OffsetDateTime.parse("2025-01-01T00:00:00Z"));
        when(redisTemplate.opsForSet()).thenReturn(setOperations);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(setOperations.members("user:refresh:" + USER_ID)).thenReturn(new LinkedHashSet<>(List.of("fp1", "fp2")));
        List<String> values = new ArrayList<>(Arrays.asList(objectMapper.writeValueAsString(live), null));
        when(valueOperations.multiGet(List.of("refresh:" + USER_ID + ":fp1", "refresh:" + USER_ID + ":fp2"))).thenReturn(values);

        List<FingerprintMetadata> sessions = store.list(USER_ID);

        assertThat(sessions).extracting(FingerprintMetadata::fingerprint).containsExactly("fp1");
    }

    @SuppressWarnings("unchecked")
    private void runTransactionsAgainst(RedisOperations<String, String> target) {
        when(redisTemplate.execute(any(SessionCallback.class))).thenAnswer(invocation -> {
            SessionCallback<Object> callback = invocation.getArgument(0);
            return callback.execute(target);
        });
    }
}
