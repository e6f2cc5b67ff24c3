package com.tripmate.backend.global.web;

import jakarta.servlet.http.HttpServletRequest;

public final class ClientIpResolver {

    private ClientIpResolver() {
    }

    /**
     * Socket address of the client. Forwarded headers are never read here: behind a trusted proxy
     * the container has already replaced the remote address (see {@code server.forward-headers-strategy}).
     */
    public static String resolve(HttpServletRequest request) {
        return request.getRemoteAddr();
    }
}
