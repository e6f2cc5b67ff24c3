package com.tripmate.backend.modules.auth.application;

import java.security.SecureRandom;
import java.util.HexFormat;

import org.springframework.stereotype.Component;

/**
 * Random hex tokens for password reset and email verification links.
 */
@Component
public class OneTimeTokenGenerator {

    private static final int TOKEN_BYTES = 32;

    private final SecureRandom secureRandom;

    public OneTimeTokenGenerator(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    public String next() {
        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
