package com.techStack.geoVault.repository.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Multi-node store on Redis. Values use {@code SET ... PX}; the sliding window runs as one Lua script
 * over a sorted set so concurrent checks on the same key cannot interleave.
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "security.state-store.type", havingValue = "redis")
public class RedisSecurityStateStore implements SecurityStateStore {

    private final ReactiveStringRedisTemplate redisTemplate;
    private final RedisScript<List> slidingWindowScript;
    private final Clock clock;

    public RedisSecurityStateStore(ReactiveStringRedisTemplate redisTemplate,
                                   @Qualifier("slidingWindowScript") RedisScript<List> slidingWindowScript,
                                   Clock clock) {
        this.redisTemplate = redisTemplate;
        this.slidingWindowScript = slidingWindowScript;
        this.clock = clock;
    }

    @Override
    public Mono<Void> put(String key, String value, Duration ttl) {
        if (ttl.isZero() || ttl.isNegative()) {
            return delete(key);
        }
        return redisTemplate.opsForValue().set(key, value, ttl).then();
    }

    @Override
    public Mono<String> get(String key) {
        return redisTemplate.opsForValue().get(key);
    }

    @Override
    public Mono<Boolean> exists(String key) {
        return redisTemplate.hasKey(key);
    }

    @Override
    public Mono<Void> delete(String key) {
        return redisTemplate.delete(key).then();
    }

    @Override
    public Mono<String> take(String key) {
        return redisTemplate.opsForValue().getAndDelete(key);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Mono<SlidingWindowResult> recordAttempt(String key, int maxAttempts, Duration window) {
        if (maxAttempts < 1) {
            return Mono.error(new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts));
        }
        long now = clock.millis();
        List<String> args = List.of(
                Long.toString(now),
                Long.toString(window.toMillis()),
                Integer.toString(maxAttempts),
                now + "-" + UUID.randomUUID());

        return redisTemplate.execute(slidingWindowScript, List.of(key), args)
                .next()
                .map(raw -> {
                    List<Long> reply = (List<Long>) raw;
                    return new SlidingWindowResult(
                            reply.get(0) == 1L,
                            reply.get(1).intValue(),
                            Duration.ofMillis(Math.max(0, reply.get(2))));
                })
                .doOnError(e -> log.error("❌ Redis sliding window failed for {}: {}", key, e.getMessage()));
    }
}
