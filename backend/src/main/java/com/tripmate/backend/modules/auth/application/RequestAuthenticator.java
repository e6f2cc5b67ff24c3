package com.tripmate.backend.modules.auth.application;

import java.util.Optional;
import java.util.UUID;

import com.tripmate.backend.global.cache.CacheUnavailableException;
import com.tripmate.backend.global.error.ErrorCode;
import com.tripmate.backend.global.error.ProblemException;
import com.tripmate.backend.global.security.AuthenticatedPrincipal;
import com.tripmate.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.tripmate.backend.modules.auth.application.JwtTokenService.TokenClaims;
import com.tripmate.backend.modules.auth.application.JwtTokenService.TokenExpiredException;
import com.tripmate.backend.modules.auth.domain.User;
import com.tripmate.backend.modules.auth.infrastructure.persistence.UserProfileRepository;
import com.tripmate.backend.modules.auth.infrastructure.persistence.UserRepository;
import com.tripmate.backend.modules.permission.application.PermissionService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Turns a bearer access token into an {@link AuthenticatedPrincipal}.
 *
 * <p>The blacklist is consulted first on every call and its outage rejects the request. A hit in
 * the access-token cache skips signature verification; otherwise the JWT is verified and the
 * caches are filled for the next request.
 */
@Service
@Transactional(readOnly = true)
public class RequestAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(RequestAuthenticator.class);

    private final AccessTokenStore accessTokenStore;
    private final UserCacheStore userCacheStore;
    private final UserRepository userRepository;
    private final UserProfileRepository userProfileRepository;
    private final JwtTokenService jwtTokenService;
    private final PermissionService permissionService;

    public RequestAuthenticator(
            AccessTokenStore accessTokenStore,
            UserCacheStore userCacheStore,
            UserRepository userRepository,
            UserProfileRepository userProfileRepository,
            JwtTokenService jwtTokenService,
            PermissionService permissionService
    ) {
        this.accessTokenStore = accessTokenStore;
        this.userCacheStore = userCacheStore;
        this.userRepository = userRepository;
        this.userProfileRepository = userProfileRepository;
        this.jwtTokenService = jwtTokenService;
        this.permissionService = permissionService;
    }

    public AuthenticatedPrincipal authenticate(String rawAccessToken) {
        if (rawAccessToken == null || rawAccessToken.isBlank()) {
            throw new ProblemException(ErrorCode.UNAUTHENTICATED);
        }
        rejectIfBlacklisted(rawAccessToken);

        Optional<CachedAccessToken> cached = accessTokenStore.validate(rawAccessToken);
        if (cached.isPresent()) {
            return principalFor(loadUser(cached.get().userId()));
        }

        TokenClaims claims;
        try {
            claims = jwtTokenService.verifyAccess(rawAccessToken);
        } catch (TokenExpiredException ex) {
            accessTokenStore.invalidate(rawAccessToken);
            throw new ProblemException(ErrorCode.TOKEN_EXPIRED);
        } catch (InvalidTokenException ex) {
            log.debug("Rejected access token: {}", ex.getMessage());
            throw new ProblemException(ErrorCode.INVALID_TOKEN);
        }

        CachedUser user = loadUser(claims.userId());
        AuthenticatedPrincipal principal = principalFor(user);
        accessTokenStore.cache(user.id(), rawAccessToken, jwtTokenService.remainingLifetime(claims));
        return principal;
    }

    private void rejectIfBlacklisted(String rawAccessToken) {
        boolean blacklisted;
        try {
            blacklisted = accessTokenStore.isBlacklisted(rawAccessToken);
        } catch (CacheUnavailableException ex) {
            log.error("Token blacklist unavailable, rejecting request", ex);
            throw new ProblemException(ErrorCode.AUTH_BACKEND_UNAVAILABLE, null, ex);
        }
        if (blacklisted) {
            throw new ProblemException(ErrorCode.TOKEN_REVOKED);
        }
    }

    private CachedUser loadUser(UUID userId) {
        return userCacheStore.findById(userId).orElseGet(() -> {
            User user = userRepository.findById(userId)
                    .orElseThrow(() -> new ProblemException(ErrorCode.USER_NOT_FOUND));
            CachedUser snapshot = CachedUser.from(user, userProfileRepository.findByUserId(userId).orElse(null));
            userCacheStore.cache(snapshot);
            return snapshot;
        });
    }

    private AuthenticatedPrincipal principalFor(CachedUser user) {
        boolean superAdmin = permissionService.isSuperAdmin(user.id());
        return new AuthenticatedPrincipal(user.id(), user.email(), user.name(), user.phone(), superAdmin);
    }
}
