package com.techStack.geoVault.service.security;

import reactor.core.publisher.Mono;

import java.time.Duration;

public interface RateLimiterService {

    /**
     * Records an attempt for {@code identifier}; errors with
     * {@link com.techStack.geoVault.exception.security.RateLimitExceededException} once
     * {@code maxAttempts} have been made within {@code window}.
     */
    Mono<Void> checkRateLimit(String identifier, int maxAttempts, Duration window);

    Mono<Void> checkLoginRateLimit(String username);

    Mono<Void> checkApiRateLimit(String clientIp);
}
