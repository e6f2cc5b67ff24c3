package com.tripmate.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.UUID;

import javax.crypto.SecretKey;

import com.tripmate.backend.global.config.AuthProperties;
import com.tripmate.backend.modules.auth.infrastructure.jwt.JwtSigningKeys;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.stereotype.Service;

@Service
public class JwtTokenService {

    static final String CLAIM_USER_ID = "userId";
    static final String CLAIM_EMAIL = "email";

    private final JwtSigningKeys signingKeys;
    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;
    private final Clock clock;

    public JwtTokenService(JwtSigningKeys signingKeys, AuthProperties properties, Clock clock) {
        this.signingKeys = signingKeys;
        this.accessTokenTtl = properties.accessTokenTtl();
        this.refreshTokenTtl = properties.refreshTokenTtl();
        this.clock = clock;
    }

    public TokenPair issueTokenPair(UUID userId, String email) {
        Instant now = clock.instant();
        String accessToken = sign(userId, email, now, accessTokenTtl, signingKeys.accessKey());
        String refreshToken = sign(userId, email, now, refreshTokenTtl, signingKeys.refreshKey());
        return new TokenPair(
                accessToken,
                refreshToken,
                accessTokenTtl.toSeconds(),
                refreshTokenTtl.toSeconds(),
                OffsetDateTime.ofInstant(now, clock.getZone())
        );
    }

    public String issueAccessToken(UUID userId, String email) {
        return sign(userId, email, clock.instant(), accessTokenTtl, signingKeys.accessKey());
    }

    public TokenClaims verifyAccess(String token) {
        return verify(token, signingKeys.accessKey(), "access");
    }

    public TokenClaims verifyRefresh(String token) {
        return verify(token, signingKeys.refreshKey(), "refresh");
    }

    /**
     * Time until the token expires, never negative.
     */
    public Duration remainingLifetime(TokenClaims claims) {
        Duration remaining = Duration.between(clock.instant(), claims.expiresAt().toInstant());
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public Duration getAccessTokenTtl() {
        return accessTokenTtl;
    }

    public Duration getRefreshTokenTtl() {
        return refreshTokenTtl;
    }

    private String sign(UUID userId, String email, Instant issuedAt, Duration ttl, SecretKey key) {
        return Jwts.builder()
                .subject(userId.toString())
                .id(UUID.randomUUID().toString())
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(issuedAt.plus(ttl)))
                .claim(CLAIM_USER_ID, userId.toString())
                .claim(CLAIM_EMAIL, email)
                .signWith(key, SIG.HS256)
                .compact();
    }

    private TokenClaims verify(String token, SecretKey key, String kind) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Missing " + kind + " token", null);
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            String rawUserId = claims.get(CLAIM_USER_ID, String.class);
            UUID userId = UUID.fromString(rawUserId != null ? rawUserId : claims.getSubject());
            Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : clock.instant();
            if (claims.getExpiration() == null) {
                throw new InvalidTokenException("Token has no expiry", null);
            }
            Instant expiresAt = claims.getExpiration().toInstant();

            return new TokenClaims(
                    userId,
                    claims.get(CLAIM_EMAIL, String.class),
                    claims.getId(),
                    OffsetDateTime.ofInstant(issuedAt, clock.getZone()),
                    OffsetDateTime.ofInstant(expiresAt, clock.getZone())
            );
        } catch (ExpiredJwtException e) {
            throw new TokenExpiredException("Expired " + kind + " token", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid " + kind + " token", e);
        }
    }

    public record TokenPair(
            String accessToken,
            String refreshToken,
            long accessExpiresIn,
            long refreshExpiresIn,
            OffsetDateTime issuedAt
    ) {
    }

    public record TokenClaims(UUID userId, String email, String tokenId, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static class TokenExpiredException extends RuntimeException {
        public TokenExpiredException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
