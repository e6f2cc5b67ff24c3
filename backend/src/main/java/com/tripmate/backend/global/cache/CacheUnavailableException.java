package com.tripmate.backend.global.cache;

/**
 * Raised by cache adapters when a read must not be silently treated as a miss.
 */
public class CacheUnavailableException extends RuntimeException {

    public CacheUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
