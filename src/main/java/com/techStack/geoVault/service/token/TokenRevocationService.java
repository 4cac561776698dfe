package com.techStack.geoVault.service.token;

import com.techStack.geoVault.constants.SecurityConstants;
import com.techStack.geoVault.models.auth.TokenClaims;
import com.techStack.geoVault.repository.security.SecurityStateStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;

/**
 * Revoked token ids, each kept only for the remaining lifetime of its token.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenRevocationService {

    private final SecurityStateStore stateStore;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public Mono<Void> revoke(TokenClaims claims) {
        Duration remaining = claims.remainingLifetime(clock.instant());
        if (remaining.isZero()) {
            return Mono.empty();
        }
        return stateStore.put(key(claims.tokenId()), claims.subject(), remaining)
                .doOnSuccess(v -> {
                    meterRegistry.counter("auth.token.revoked", "type", claims.type().name()).increment();
                    log.debug("Revoked {} token {} for {}s", claims.type(), claims.tokenId(), remaining.toSeconds());
                });
    }

    public Mono<Boolean> isRevoked(String tokenId) {
        return stateStore.exists(key(tokenId));
    }

    private static String key(String tokenId) {
        return SecurityConstants.REVOKED_PREFIX + tokenId;
    }
}
