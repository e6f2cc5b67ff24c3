package com.tripmate.backend.global.security;

import java.util.UUID;

public record AuthenticatedPrincipal(
        UUID userId,
        String email,
        String name,
        String phone,
        boolean superAdmin
) {
}
