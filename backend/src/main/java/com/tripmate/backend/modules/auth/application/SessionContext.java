package com.tripmate.backend.modules.auth.application;

/**
 * Client details recorded with each refresh-token fingerprint.
 */
public record SessionContext(String userAgent, String ip) {

    public static SessionContext unknown() {
        return new SessionContext(null, null);
    }
}
