package com.tripmate.backend.modules.auth.application;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import com.tripmate.backend.global.cache.TokenDigests;
import com.tripmate.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.tripmate.backend.modules.auth.application.JwtTokenService.TokenClaims;
import com.tripmate.backend.modules.auth.application.JwtTokenService.TokenExpiredException;
import com.tripmate.backend.modules.auth.domain.RefreshToken;
import com.tripmate.backend.modules.auth.infrastructure.persistence.RefreshTokenRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Ends sessions in both places a refresh token lives, the fingerprint cache and the durable rows.
 */
@Service
@Transactional
public class SessionRevocationService {

    private static final Logger log = LoggerFactory.getLogger(SessionRevocationService.class);

    private final RefreshTokenFingerprintStore fingerprintStore;
    private final RefreshTokenRepository refreshTokenRepository;
    private final AccessTokenStore accessTokenStore;
    private final JwtTokenService jwtTokenService;

    public SessionRevocationService(
            RefreshTokenFingerprintStore fingerprintStore,
            RefreshTokenRepository refreshTokenRepository,
            AccessTokenStore accessTokenStore,
            JwtTokenService jwtTokenService
    ) {
        this.fingerprintStore = fingerprintStore;
        this.refreshTokenRepository = refreshTokenRepository;
        this.accessTokenStore = accessTokenStore;
        this.jwtTokenService = jwtTokenService;
    }

    public void revokeSession(UUID userId, String rawRefreshToken) {
        fingerprintStore.remove(userId, rawRefreshToken);
        int revoked = refreshTokenRepository.revokeByTokenAndUser(rawRefreshToken, userId);
        log.info("Revoked session of user {} ({} durable row)", userId, revoked);
    }

    /**
     * Ends the session known by its fingerprint. Durable rows are matched by fingerprinting their
     * token, so the session can be found even after the cache lost it.
     *
     * @return whether any session material was found
     */
    public boolean revokeSessionByFingerprint(UUID userId, String fingerprint) {
        boolean cached = fingerprintStore.removeByFingerprint(userId, fingerprint);
        int revoked = 0;
        for (RefreshToken row : refreshTokenRepository.findUnrevokedByUser(userId)) {
            if (fingerprint.equals(fingerprintStore.fingerprint(row.getToken()))) {
                row.setRevoked(true);
                revoked++;
            }
        }
        if (cached || revoked > 0) {
            log.info("Revoked session {} of user {} ({} durable row)", TokenDigests.logRef(fingerprint), userId, revoked);
            return true;
        }
        return false;
    }

    public void revokeAllSessions(UUID userId) {
        fingerprintStore.removeAll(userId);
        int revoked = refreshTokenRepository.revokeAllByUser(userId);
        log.info("Revoked all sessions of user {} ({} durable rows)", userId, revoked);
    }

    /**
     * Blacklists the access token for whatever lifetime it has left. Tokens that no longer verify
     * are already unusable and are skipped.
     */
    public void blacklistAccessToken(String rawAccessToken) {
        if (rawAccessToken == null || rawAccessToken.isBlank()) {
            return;
        }
        try {
            TokenClaims claims = jwtTokenService.verifyAccess(rawAccessToken);
            Duration remaining = jwtTokenService.remainingLifetime(claims);
            accessTokenStore.blacklist(rawAccessToken, remaining);
        } catch (TokenExpiredException | InvalidTokenException ex) {
            accessTokenStore.invalidate(rawAccessToken);
        }
    }

    @Transactional(readOnly = true)
    public List<FingerprintMetadata> listSessions(UUID userId) {
        return fingerprintStore.list(userId);
    }
}
