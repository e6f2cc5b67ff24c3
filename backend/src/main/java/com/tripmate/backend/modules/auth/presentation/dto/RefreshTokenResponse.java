package com.tripmate.backend.modules.auth.presentation.dto;

public record RefreshTokenResponse(
        String accessToken,
        String refreshToken,
        String tokenType,
        long accessExpiresIn
) {
}
