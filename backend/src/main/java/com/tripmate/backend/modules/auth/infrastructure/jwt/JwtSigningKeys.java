package com.tripmate.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;

import javax.crypto.SecretKey;

import com.tripmate.backend.global.config.AuthProperties;

import io.jsonwebtoken.security.Keys;
import org.springframework.stereotype.Component;

/**
 * HMAC keys for the two token kinds. Access and refresh tokens never share a key, so a token of
 * one kind cannot be verified as the other.
 */
@Component
public class JwtSigningKeys {

    private final SecretKey accessKey;
    private final SecretKey refreshKey;

    public JwtSigningKeys(AuthProperties properties) {
        this.accessKey = toKey(properties.accessSecret(), "access");
        this.refreshKey = toKey(properties.refreshSecret(), "refresh");
    }

    public SecretKey accessKey() {
        return accessKey;
    }

    public SecretKey refreshKey() {
        return refreshKey;
    }

    private static SecretKey toKey(String secret, String kind) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("JWT " + kind + " secret is not configured");
        }
        return Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }
}
