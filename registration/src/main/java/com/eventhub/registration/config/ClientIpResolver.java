package com.eventhub.registration.config;

import jakarta.servlet.http.HttpServletRequest;

/**
 * First hop of X-Forwarded-For, else the socket address.
 */
public final class ClientIpResolver {

    private ClientIpResolver() {
        // utility class
    }

    public static String resolve(HttpServletRequest request) {
        String xff = request.getHeader("X-Forwarded-For");
        if (xff != null && !xff.isBlank()) {
            return xff.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
