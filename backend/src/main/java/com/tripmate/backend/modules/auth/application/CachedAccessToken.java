package com.tripmate.backend.modules.auth.application;

import java.util.UUID;

public record CachedAccessToken(UUID userId, String type) {

    public static final String TYPE_ACCESS = "access";

    public static CachedAccessToken access(UUID userId) {
        return new CachedAccessToken(userId, TYPE_ACCESS);
    }
}
