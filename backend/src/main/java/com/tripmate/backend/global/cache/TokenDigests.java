package com.tripmate.backend.global.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helpers for turning raw tokens into cache keys. Raw tokens never reach Redis.
 */
public final class TokenDigests {

    private static final int LOG_PREFIX_LENGTH = 8;

    private TokenDigests() {
    }

    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    /**
     * Short digest prefix that is safe to put in a log line.
     */
    public static String logRef(String digest) {
        if (digest == null) {
            return "-";
        }
        return digest.length() <= LOG_PREFIX_LENGTH ? digest : digest.substring(0, LOG_PREFIX_LENGTH);
    }
}
