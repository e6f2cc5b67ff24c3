package com.tripmate.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

import com.tripmate.backend.modules.auth.application.FingerprintMetadata;

public record SessionResponse(
        String sessionId,
        OffsetDateTime createdAt,
        OffsetDateTime loginTime,
        String userAgent,
        String ip,
        boolean restored
) {

    public static SessionResponse from(FingerprintMetadata metadata) {
        return new SessionResponse(
                metadata.fingerprint(),
                metadata.createdAt(),
                metadata.loginTime(),
                metadata.userAgent(),
                metadata.ip(),
                metadata.restored()
        );
    }
}
