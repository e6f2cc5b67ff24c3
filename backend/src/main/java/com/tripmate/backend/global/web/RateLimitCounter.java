package com.tripmate.backend.global.web;

import java.time.Duration;

/**
 * Fixed-window request counter.
 */
public interface RateLimitCounter {

    /**
     * Counts one hit against {@code key}, opening a new window of {@code window} on the first hit.
     */
    Window increment(String key, Duration window);

    /**
     * @param count hits in the current window, this one included
     * @param resetSeconds seconds until the window closes
     */
    record Window(long count, long resetSeconds) {
    }
}
