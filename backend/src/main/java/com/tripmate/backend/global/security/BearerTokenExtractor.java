package com.tripmate.backend.global.security;

import java.util.Locale;
import java.util.Optional;

/**
 * Reads the token out of an {@code Authorization: Bearer <token>} header value.
 */
public final class BearerTokenExtractor {

    private static final String BEARER_PREFIX = "bearer ";

    private BearerTokenExtractor() {
    }

    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null) {
            return Optional.empty();
        }
        String header = authorizationHeader.strip();
        if (header.length() <= BEARER_PREFIX.length()
                || !header.substring(0, BEARER_PREFIX.length()).toLowerCase(Locale.ROOT).equals(BEARER_PREFIX)) {
            return Optional.empty();
        }
        String token = header.substring(BEARER_PREFIX.length()).strip();
        if (token.isEmpty() || token.contains(" ")) {
            return Optional.empty();
        }
        return Optional.of(token);
    }
}
