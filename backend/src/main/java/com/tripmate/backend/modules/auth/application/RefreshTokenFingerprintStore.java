package com.tripmate.backend.modules.auth.application;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Fast lookup of issued refresh tokens by fingerprint. An empty {@link #validate} result means
 * "not known to the cache" and callers fall back to the durable refresh-token rows.
 */
public interface RefreshTokenFingerprintStore {

    /**
     * @return the fingerprint the token was stored under
     */
    String store(UUID userId, String rawRefreshToken, FingerprintMetadata metadata);

    Optional<FingerprintMetadata> validate(UUID userId, String rawRefreshToken);

    /**
     * Removes the keyed entry and its membership in the user's set together.
     */
    void remove(UUID userId, String rawRefreshToken);

    /**
     * Same as {@link #remove} for callers that only know the fingerprint.
     *
     * @return whether a cached entry or set member was removed
     */
    boolean removeByFingerprint(UUID userId, String fingerprint);

    void removeAll(UUID userId);

    List<FingerprintMetadata> list(UUID userId);

    String fingerprint(String rawRefreshToken);
}
