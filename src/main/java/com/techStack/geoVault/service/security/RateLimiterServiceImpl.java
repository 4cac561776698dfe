package com.techStack.geoVault.service.security;

import com.techStack.geoVault.config.security.RateLimitProperties;
import com.techStack.geoVault.constants.SecurityConstants;
import com.techStack.geoVault.exception.security.RateLimitExceededException;
import com.techStack.geoVault.repository.security.SecurityStateStore;
import com.techStack.geoVault.util.validation.HelperUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;

@Slf4j
@Service
@RequiredArgsConstructor
public class RateLimiterServiceImpl implements RateLimiterService {

    private final SecurityStateStore stateStore;
    private final RateLimitProperties properties;

    @Override
    public Mono<Void> checkRateLimit(String identifier, int maxAttempts, Duration window) {
        return stateStore.recordAttempt(SecurityConstants.RATE_LIMIT_PREFIX + identifier, maxAttempts, window)
                .flatMap(result -> {
                    if (result.allowed()) {
                        return Mono.<Void>empty();
                    }
                    log.debug("🚫 Rate limit exceeded for {} ({} attempts in {})",
                            identifier, result.count(), window);
                    return Mono.error(new RateLimitExceededException(result.retryAfter()));
                });
    }

    @Override
    public Mono<Void> checkLoginRateLimit(String username) {
        RateLimitProperties.Limit limit = properties.getLogin();
        if (!limit.isEnabled()) {
            return Mono.empty();
        }
        return checkRateLimit("login:" + username, limit.getMaxAttempts(), limit.getWindow())
                .doOnError(RateLimitExceededException.class, e ->
                        log.warn("Login attempts throttled for {}", HelperUtils.maskUsername(username)));
    }

    @Override
    public Mono<Void> checkApiRateLimit(String clientIp) {
        RateLimitProperties.Limit limit = properties.getApi();
        if (!limit.isEnabled()) {
            return Mono.empty();
        }
        return checkRateLimit("api:" + clientIp, limit.getMaxAttempts(), limit.getWindow());
    }
}
