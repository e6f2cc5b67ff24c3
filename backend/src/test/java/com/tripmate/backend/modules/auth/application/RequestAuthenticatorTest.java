package com.tripmate.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import com.tripmate.backend.global.cache.CacheUnavailableException;
import com.tripmate.backend.global.error.ErrorCode;
import com.tripmate.backend.global.security.AuthenticatedPrincipal;
import com.tripmate.backend.modules.auth.domain.User;
import com.tripmate.backend.modules.auth.infrastructure.jwt.JwtSigningKeys;
import com.tripmate.backend.modules.auth.infrastructure.persistence.UserProfileRepository;
import com.tripmate.backend.modules.auth.infrastructure.persistence.UserRepository;
import com.tripmate.backend.modules.permission.application.PermissionService;
import com.tripmate.backend.support.MutableClock;
import com.tripmate.backend.support.TestAuthProperties;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RequestAuthenticatorTest {

    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000100");
    private static final CachedUser CACHED_USER =
            new CachedUser(USER_ID, "user@tripmate.test", "User", null, true, null);

    @Mock
    private AccessTokenStore accessTokenStore;

    @Mock
    private UserCacheStore userCacheStore;

    @Mock
    private UserRepository userRepository;

    @Mock
    private UserProfileRepository userProfileRepository;

    @Mock
    private PermissionService permissionService;

    private MutableClock clock;
    private JwtTokenService jwtTokenService;
    private RequestAuthenticator authenticator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-05-01T00:00:00Z"));
        jwtTokenService = new JwtTokenService(
                new JwtSigningKeys(TestAuthProperties.defaults()), TestAuthProperties.defaults(), clock);
        authenticator = new RequestAuthenticator(accessTokenStore, userCacheStore, userRepository,
                userProfileRepository, jwtTokenService, permissionService);
    }

    @Test
    void missingTokenIsUnauthenticated() {
        assertThatThrownBy(() -> authenticator.authenticate("  "))
                .extracting("errorCode").isEqualTo(ErrorCode.UNAUTHENTICATED);
    }

    @Test
    void cachedTokenSkipsSignatureVerification() {
        when(accessTokenStore.validate("opaque-cached-token")).thenReturn(Optional.of(CachedAccessToken.access(USER_ID)));
        when(userCacheStore.findById(USER_ID)).thenReturn(Optional.of(CACHED_USER));
        when(permissionService.isSuperAdmin(USER_ID)).thenReturn(true);

        AuthenticatedPrincipal principal = authenticator.authenticate("opaque-cached-token");

        assertThat(principal.userId()).isEqualTo(USER_ID);
        assertThat(principal.superAdmin()).isTrue();
        verify(userRepository, never()).findById(any());
    }

    @Test
    void blacklistIsCheckedBeforeTheCache() {
        when(accessTokenStore.isBlacklisted("revoked-token")).thenReturn(true);

        assertThatThrownBy(() -> authenticator.authenticate("revoked-token"))
                .extracting("errorCode").isEqualTo(ErrorCode.TOKEN_REVOKED);
        verify(accessTokenStore, never()).validate(any());
    }

    @Test
    void unreachableBlacklistRejectsTheRequest() {
        when(accessTokenStore.isBlacklisted("any-token"))
                .thenThrow(new CacheUnavailableException("Blacklist lookup failed", new IllegalStateException("timeout")));

        assertThatThrownBy(() -> authenticator.authenticate("any-token"))
                .extracting("errorCode").isEqualTo(ErrorCode.AUTH_BACKEND_UNAVAILABLE);
        verify(accessTokenStore, never()).validate(any());
    }

    @Test
    void expiredTokenIsDroppedFromTheCache() {
        String token = jwtTokenService.issueAccessToken(USER_ID, CACHED_USER.email());
        clock.advance(Duration.ofDays(2));

        assertThatThrownBy(() -> authenticator.authenticate(token))
                .extracting("errorCode").isEqualTo(ErrorCode.TOKEN_EXPIRED);
        verify(accessTokenStore).invalidate(token);
    }

    @Test
    void tamperedTokenIsInvalid() {
        String token = jwtTokenService.issueTokenPair(USER_ID, CACHED_USER.email()).refreshToken();

        assertThatThrownBy(() -> authenticator.authenticate(token))
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_TOKEN);
        assertThatThrownBy(() -> authenticator.authenticate("not-a-jwt"))
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_TOKEN);
    }

    @Test
    void verifiedTokenForDeletedUserIsRejected() {
        String token = jwtTokenService.issueAccessToken(USER_ID, CACHED_USER.email());
        when(userRepository.findById(USER_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> authenticator.authenticate(token))
                .extracting("errorCode").isEqualTo(ErrorCode.USER_NOT_FOUND);
        verify(accessTokenStore, never()).cache(any(), any(), any());
    }

    @Test
    void verifiedTokenFillsCachesForItsRemainingLifetime() {
        String token = jwtTokenService.issueAccessToken(USER_ID, CACHED_USER.email());
        clock.advance(Duration.ofHours(6));
        User user = new User();
        user.setId(USER_ID);
        user.setEmail(CACHED_USER.email());
        user.setName("User");
        when(userRepository.findById(USER_ID)).thenReturn(Optional.of(user));
        when(userProfileRepository.findByUserId(USER_ID)).thenReturn(Optional.empty());

        AuthenticatedPrincipal principal = authenticator.authenticate(token);

        assertThat(principal.email()).isEqualTo(CACHED_USER.email());
        assertThat(principal.superAdmin()).isFalse();
        ArgumentCaptor<CachedUser> cached = ArgumentCaptor.forClass(CachedUser.class);
        verify(userCacheStore).cache(cached.capture());
        assertThat(cached.getValue().id()).isEqualTo(USER_ID);
        verify(accessTokenStore).cache(USER_ID, token, Duration.ofHours(18));
    }
}
