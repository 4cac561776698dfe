package com.techStack.geoVault.service.token;

import com.techStack.geoVault.constants.SecurityConstants;
import com.techStack.geoVault.exception.auth.InvalidTokenException;
import com.techStack.geoVault.models.auth.TokenClaims;
import com.techStack.geoVault.models.auth.TokenType;
import com.techStack.geoVault.repository.security.SecurityStateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Duration;

/**
 * One active CSRF token per user. Issuing a new token replaces the previous one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CsrfTokenService {

    private final JwtService jwtService;
    private final SecurityStateStore stateStore;

    public Mono<String> issue(String username) {
        return Mono.fromCallable(() -> jwtService.generateToken(username, null, TokenType.CSRF))
                .flatMap(token -> stateStore.put(key(username), token,
                                Duration.ofSeconds(jwtService.expirationSeconds(TokenType.CSRF)))
                        .thenReturn(token));
    }

    /**
     * True only for a validly signed CSRF token for {@code username} that is also the one currently stored.
     */
    public Mono<Boolean> verify(String username, String token) {
        if (StringUtils.isAnyBlank(username, token)) {
            return Mono.just(false);
        }

        TokenClaims claims;
        try {
            claims = jwtService.parse(token, TokenType.CSRF);
        } catch (InvalidTokenException e) {
            log.debug("CSRF token rejected: {}", e.getMessage());
            return Mono.just(false);
        }
        if (!username.equals(claims.subject())) {
            return Mono.just(false);
        }

        return stateStore.get(key(username))
                .map(stored -> MessageDigest.isEqual(
                        stored.getBytes(StandardCharsets.UTF_8),
                        token.getBytes(StandardCharsets.UTF_8)))
                .defaultIfEmpty(false);
    }

    public Mono<Void> invalidate(String username) {
        return stateStore.delete(key(username));
    }

    private static String key(String username) {
        return SecurityConstants.CSRF_PREFIX + username;
    }
}
