package com.tripmate.backend.modules.auth.presentation.dto;

import java.util.UUID;

import com.tripmate.backend.modules.auth.application.CachedUser;

public record UserResponse(
        UUID id,
        String email,
        String name,
        String phone,
        boolean emailVerified,
        boolean superAdmin,
        CachedUser.Profile profile
) {

    public static UserResponse of(CachedUser user, boolean superAdmin) {
        return new UserResponse(
                user.id(),
                user.email(),
                user.name(),
                user.phone(),
                user.emailVerified(),
                superAdmin,
                user.profile()
        );
    }
}
