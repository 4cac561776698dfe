package com.techStack.geoVault.repository.security;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Key-value state shared by the session machinery: revoked token ids, CSRF tokens,
 * password-reset tokens and rate-limit windows. Every operation is atomic per key and
 * every entry carries a TTL after which it is no longer visible.
 */
public interface SecurityStateStore {

    Mono<Void> put(String key, String value, Duration ttl);

    Mono<String> get(String key);

    Mono<Boolean> exists(String key);

    Mono<Void> delete(String key);

    /**
     * Returns the value and removes it in one step, so only one caller can ever observe it.
     */
    Mono<String> take(String key);

    /**
     * Drops attempts older than {@code window}, then records a new one only if fewer than
     * {@code maxAttempts} remain. Signals {@link IllegalArgumentException} when {@code maxAttempts < 1}.
     */
    Mono<SlidingWindowResult> recordAttempt(String key, int maxAttempts, Duration window);
}
