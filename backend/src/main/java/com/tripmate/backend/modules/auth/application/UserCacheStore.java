package com.tripmate.backend.modules.auth.application;

import java.util.Optional;
import java.util.UUID;

public interface UserCacheStore {

    /**
     * Writes the user under its id and its email, and the profile under the user id.
     */
    void cache(CachedUser user);

    Optional<CachedUser> findById(UUID userId);

    Optional<CachedUser> findByEmail(String email);

    /**
     * Drops the id, email and profile entries. {@code email} may be null when unknown.
     */
    void invalidate(UUID userId, String email);
}
