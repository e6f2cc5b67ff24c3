package com.tripmate.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

import com.tripmate.backend.modules.auth.application.JwtTokenService.TokenPair;

public record TokenPairResponse(
        String accessToken,
        String refreshToken,
        String tokenType,
        long accessExpiresIn,
        long refreshExpiresIn,
        OffsetDateTime issuedAt
) {
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";

    public static TokenPairResponse from(TokenPair pair) {
        return new TokenPairResponse(
                pair.accessToken(),
                pair.refreshToken(),
                DEFAULT_TOKEN_TYPE,
                pair.accessExpiresIn(),
                pair.refreshExpiresIn(),
                pair.issuedAt()
        );
    }
}
