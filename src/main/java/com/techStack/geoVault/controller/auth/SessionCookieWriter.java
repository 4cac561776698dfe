package com.techStack.geoVault.controller.auth;

import com.techStack.geoVault.config.security.SessionCookieProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseCookie;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;

import java.time.Duration;

import static com.techStack.geoVault.constants.SecurityConstants.ACCESS_TOKEN_COOKIE;
import static com.techStack.geoVault.constants.SecurityConstants.REFRESH_TOKEN_COOKIE;

/**
 * HttpOnly session cookies for browser clients.
 */
@Component
@RequiredArgsConstructor
public class SessionCookieWriter {

    private final SessionCookieProperties properties;

    public void writeAccess(ServerHttpResponse response, String token, long maxAgeSeconds) {
        response.addCookie(cookie(ACCESS_TOKEN_COOKIE, token, Duration.ofSeconds(maxAgeSeconds)));
    }

    public void writeRefresh(ServerHttpResponse response, String token, long maxAgeSeconds) {
        response.addCookie(cookie(REFRESH_TOKEN_COOKIE, token, Duration.ofSeconds(maxAgeSeconds)));
    }

    public void clear(ServerHttpResponse response) {
        response.addCookie(cookie(ACCESS_TOKEN_COOKIE, "", Duration.ZERO));
        response.addCookie(cookie(REFRESH_TOKEN_COOKIE, "", Duration.ZERO));
    }

    private ResponseCookie cookie(String name, String value, Duration maxAge) {
        return ResponseCookie.from(name, value)
                .httpOnly(true)
                .secure(properties.isSecure())
                .sameSite(properties.getSameSite())
                .path(properties.getPath())
                .maxAge(maxAge)
                .build();
    }
}
