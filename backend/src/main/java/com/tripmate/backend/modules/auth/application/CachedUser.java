package com.tripmate.backend.modules.auth.application;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.tripmate.backend.modules.auth.domain.User;
import com.tripmate.backend.modules.auth.domain.UserProfile;

/**
 * Sanitized user snapshot kept in Redis and returned to clients. Holds no password or token
 * material.
 */
public record CachedUser(
        UUID id,
        String email,
        String name,
        String phone,
        boolean emailVerified,
        Profile profile
) {

    public static CachedUser from(User user, UserProfile profile) {
        return new CachedUser(
                user.getId(),
                user.getEmail(),
                user.getName(),
                user.getPhone(),
                user.isEmailVerified(),
                profile != null ? Profile.from(profile) : null
        );
    }

    public record Profile(UUID id, String bio, OffsetDateTime lastLogin, boolean emailVerified) {

        static Profile from(UserProfile profile) {
            return new Profile(profile.getId(), profile.getBio(), profile.getLastLogin(), profile.isEmailVerified());
        }
    }
}
