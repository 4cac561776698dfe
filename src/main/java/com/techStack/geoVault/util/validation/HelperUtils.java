package com.techStack.geoVault.util.validation;

import org.springframework.http.server.reactive.ServerHttpRequest;

import java.net.InetSocketAddress;

/**
 * Masking and request helpers used for logging.
 */
public final class HelperUtils {

    private HelperUtils() {
        // Utility class - private constructor
    }

    /* =========================
       Masking
       ========================= */

    /**
     * Masks email for logging.
     *
     * Examples:
     * john.doe@gmail.com → j*****e@gmail.com
     * a@test.com → a*****@test.com
     */
    public static String maskEmail(String email) {
        if (email == null || email.trim().isEmpty()) return "*****";

        String trimmedEmail = email.trim();
        int atIndex = trimmedEmail.indexOf('@');
        if (atIndex <= 0) return "*****";

        String localPart = trimmedEmail.substring(0, atIndex);
        String domain = trimmedEmail.substring(atIndex + 1);

        if (localPart.length() == 1) {
            return localPart + "*****@" + domain;
        }
        return localPart.charAt(0) + "*****" + localPart.charAt(localPart.length() - 1) + "@" + domain;
    }

    /**
     * alice → a***e, bo → b***
     */
    public static String maskUsername(String username) {
        if (username == null || username.isBlank()) return "***";
        String trimmed = username.trim();
        if (trimmed.length() <= 2) {
            return trimmed.charAt(0) + "***";
        }
        return trimmed.charAt(0) + "***" + trimmed.charAt(trimmed.length() - 1);
    }

    public static String normalizeEmail(String email) {
        return email != null ? email.trim().toLowerCase() : null;
    }

    /* =========================
       Request Helpers
       ========================= */

    /**
     * First X-Forwarded-For hop if present, else the socket peer address.
     */
    public static String clientIp(ServerHttpRequest request) {
        String forwarded = request.getHeaders().getFirst("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        InetSocketAddress remote = request.getRemoteAddress();
        if (remote == null || remote.getAddress() == null) {
            return "unknown";
        }
        return remote.getAddress().getHostAddress();
    }
}
