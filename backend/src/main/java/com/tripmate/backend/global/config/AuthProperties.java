package com.tripmate.backend.global.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Token signing and credential settings bound from {@code app.auth.*}.
 *
 * @param accessSecret          HMAC secret for access tokens
 * @param refreshSecret         HMAC secret for refresh tokens, also salts refresh-token fingerprints
 * @param accessTokenTtl        access-token lifetime
 * @param refreshTokenTtl       refresh-token lifetime, shared by fingerprints and durable rows
 * @param bcryptStrength        bcrypt work factor
 * @param resetTokenTtl         password-reset token lifetime
 * @param verificationTokenTtl  email-verification token lifetime
 */
@ConfigurationProperties(prefix = "app.auth")
public record AuthProperties(
        String accessSecret,
        String refreshSecret,
        @DefaultValue("1d") Duration accessTokenTtl,
        @DefaultValue("7d") Duration refreshTokenTtl,
        @DefaultValue("10") int bcryptStrength,
        @DefaultValue("1h") Duration resetTokenTtl,
        @DefaultValue("24h") Duration verificationTokenTtl
) {
}
