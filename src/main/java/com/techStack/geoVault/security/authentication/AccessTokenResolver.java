package com.techStack.geoVault.security.authentication;

import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpCookie;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;

import java.util.Optional;

import static com.techStack.geoVault.constants.SecurityConstants.ACCESS_TOKEN_COOKIE;
import static com.techStack.geoVault.constants.SecurityConstants.REFRESH_TOKEN_COOKIE;

/**
 * Locates the access token of a request: the {@code Authorization: Bearer} header wins over the
 * {@code access_token} cookie. Tokens in query parameters are never read.
 */
public final class AccessTokenResolver {

    private static final String BEARER_PREFIX = "Bearer ";

    public enum Source { HEADER, COOKIE }

    public record ResolvedToken(String token, Source source) {
    }

    private AccessTokenResolver() {
    }

    public static Optional<ResolvedToken> resolve(ServerHttpRequest request) {
        String header = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            String token = header.substring(BEARER_PREFIX.length()).trim();
            return token.isEmpty() ? Optional.empty() : Optional.of(new ResolvedToken(token, Source.HEADER));
        }
        return cookie(request, ACCESS_TOKEN_COOKIE).map(token -> new ResolvedToken(token, Source.COOKIE));
    }

    public static Optional<String> refreshCookie(ServerHttpRequest request) {
        return cookie(request, REFRESH_TOKEN_COOKIE);
    }

    private static Optional<String> cookie(ServerHttpRequest request, String name) {
        HttpCookie cookie = request.getCookies().getFirst(name);
        return Optional.ofNullable(cookie)
                .map(HttpCookie::getValue)
                .filter(StringUtils::isNotBlank);
    }
}
