package com.tripmate.backend.modules.auth.application;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

import com.tripmate.backend.global.cache.CacheUnavailableException;

/**
 * Cache of access tokens that already passed signature verification, plus the revocation
 * blacklist. Blacklist entries win over everything else.
 */
public interface AccessTokenStore {

    /**
     * Caches for the full access-token lifetime; used right after issuance.
     */
    void cache(UUID userId, String rawAccessToken);

    /**
     * Caches for {@code ttl}, normally the token's remaining lifetime. No-op when not positive.
     */
    void cache(UUID userId, String rawAccessToken, Duration ttl);

    /**
     * @return the cached entry, or empty on a miss or a cache read failure
     */
    Optional<CachedAccessToken> validate(String rawAccessToken);

    void invalidate(String rawAccessToken);

    /**
     * No-op when {@code ttl} is zero or negative.
     */
    void blacklist(String rawAccessToken, Duration ttl);

    /**
     * @throws CacheUnavailableException when the blacklist cannot be read
     */
    boolean isBlacklisted(String rawAccessToken);
}
