package com.techStack.geoVault.repository.security;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Single-node store on Caffeine caches with per-entry expiry driven by the injected {@link Clock}.
 * Per-key atomicity comes from {@link ConcurrentMap#compute}; expiry is checked on every read as well,
 * so an expired entry is never returned even before Caffeine's maintenance evicts it.
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "security.state-store.type", havingValue = "memory", matchIfMissing = true)
public class InMemorySecurityStateStore implements SecurityStateStore {

    private record ValueEntry(String value, Instant expiresAt) {
    }

    private record WindowEntry(List<Instant> hits, Instant expiresAt) {
    }

    private final Clock clock;
    private final ConcurrentMap<String, ValueEntry> values;
    private final ConcurrentMap<String, WindowEntry> windows;

    public InMemorySecurityStateStore(Clock clock) {
        this.clock = clock;
        Cache<String, ValueEntry> valueCache = Caffeine.newBuilder()
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .expireAfter(new EntryExpiry<ValueEntry>(clock, ValueEntry::expiresAt))
                .build();
        Cache<String, WindowEntry> windowCache = Caffeine.newBuilder()
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .expireAfter(new EntryExpiry<WindowEntry>(clock, WindowEntry::expiresAt))
                .build();
        this.values = valueCache.asMap();
        this.windows = windowCache.asMap();
        log.info("🗂️ In-memory security state store initialised");
    }

    @Override
    public Mono<Void> put(String key, String value, Duration ttl) {
        return Mono.fromRunnable(() -> {
            if (ttl.isZero() || ttl.isNegative()) {
                values.remove(key);
                return;
            }
            values.put(key, new ValueEntry(value, clock.instant().plus(ttl)));
        });
    }

    @Override
    public Mono<String> get(String key) {
        return Mono.fromCallable(() -> liveValue(key));
    }

    @Override
    public Mono<Boolean> exists(String key) {
        return Mono.fromCallable(() -> liveValue(key) != null);
    }

    @Override
    public Mono<Void> delete(String key) {
        return Mono.fromRunnable(() -> values.remove(key));
    }

    @Override
    public Mono<String> take(String key) {
        return Mono.fromCallable(() -> {
            AtomicReference<String> taken = new AtomicReference<>();
            values.computeIfPresent(key, (k, entry) -> {
                if (isLive(entry.expiresAt())) {
                    taken.set(entry.value());
                }
                return null;
            });
            return taken.get();
        });
    }

    @Override
    public Mono<SlidingWindowResult> recordAttempt(String key, int maxAttempts, Duration window) {
        if (maxAttempts < 1) {
            return Mono.error(new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts));
        }
        return Mono.fromCallable(() -> {
            Instant now = clock.instant();
            Instant cutoff = now.minus(window);
            AtomicReference<SlidingWindowResult> result = new AtomicReference<>();

            windows.compute(key, (k, existing) -> {
                List<Instant> hits = new ArrayList<>();
                if (existing != null) {
                    for (Instant hit : existing.hits()) {
                        if (hit.isAfter(cutoff)) {
                            hits.add(hit);
                        }
                    }
                }

                if (hits.size() >= maxAttempts) {
                    Duration retryAfter = Duration.between(now, hits.get(0).plus(window));
                    result.set(new SlidingWindowResult(false, hits.size(), retryAfter));
                } else {
                    hits.add(now);
                    result.set(new SlidingWindowResult(true, hits.size(), Duration.ZERO));
                }

                if (hits.isEmpty()) {
                    return null;
                }
                Instant newest = hits.get(hits.size() - 1);
                return new WindowEntry(Collections.unmodifiableList(hits), newest.plus(window));
            });
            return result.get();
        });
    }

    private String liveValue(String key) {
        ValueEntry entry = values.get(key);
        if (entry == null) {
            return null;
        }
        if (!isLive(entry.expiresAt())) {
            values.remove(key, entry);
            return null;
        }
        return entry.value();
    }

    private boolean isLive(Instant expiresAt) {
        return clock.instant().isBefore(expiresAt);
    }

    private static final class EntryExpiry<V> implements Expiry<String, V> {
        private final Clock clock;
        private final Function<V, Instant> expiresAt;

        private EntryExpiry(Clock clock, Function<V, Instant> expiresAt) {
            this.clock = clock;
            this.expiresAt = expiresAt;
        }

        @Override
        public long expireAfterCreate(String key, V value, long currentTime) {
            return remaining(value);
        }

        @Override
        public long expireAfterUpdate(String key, V value, long currentTime, long currentDuration) {
            return remaining(value);
        }

        @Override
        public long expireAfterRead(String key, V value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long remaining(V value) {
            Duration remaining = Duration.between(clock.instant(), expiresAt.apply(value));
            return remaining.isNegative() ? 0 : remaining.toNanos();
        }
    }
}
