package com.tripmate.backend.modules.auth.application;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Value stored under {@code refresh:{userId}:{fingerprint}}. {@code restored} marks entries
 * rebuilt from the durable refresh-token row after the cache lost them.
 */
public record FingerprintMetadata(
        UUID userId,
        String fingerprint,
        OffsetDateTime createdAt,
        String userAgent,
        String ip,
        OffsetDateTime loginTime,
        boolean restored
) {

    public static FingerprintMetadata forLogin(SessionContext context, OffsetDateTime loginTime) {
        return new FingerprintMetadata(null, null, null, context.userAgent(), context.ip(), loginTime, false);
    }

    public static FingerprintMetadata forRegistration(SessionContext context) {
        return new FingerprintMetadata(null, null, null, context.userAgent(), context.ip(), null, false);
    }

    public static FingerprintMetadata restoredFromDurableStore() {
        return new FingerprintMetadata(null, null, null, null, null, null, true);
    }

    public FingerprintMetadata withIdentity(UUID userId, String fingerprint, OffsetDateTime createdAt) {
        return new FingerprintMetadata(userId, fingerprint, createdAt, userAgent, ip, loginTime, restored);
    }
}
