package com.techStack.geoVault.repository.security;

import com.techStack.geoVault.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class InMemorySecurityStateStoreTest {

    private MutableClock clock;
    private InMemorySecurityStateStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));
        store = new InMemorySecurityStateStore(clock);
    }

    @Test
    void get_shouldReturnValue_untilTtlElapses() {
        store.put("k", "v", Duration.ofMinutes(5)).block();

        StepVerifier.create(store.get("k")).expectNext("v").verifyComplete();

        clock.advance(Duration.ofMinutes(5));

        StepVerifier.create(store.get("k")).verifyComplete();
        StepVerifier.create(store.exists("k")).expectNext(false).verifyComplete();
    }

    @Test
    void put_shouldRemoveEntry_whenTtlIsNotPositive() {
        store.put("k", "v", Duration.ofMinutes(5)).block();
        store.put("k", "v2", Duration.ZERO).block();

        StepVerifier.create(store.exists("k")).expectNext(false).verifyComplete();
    }

    @Test
    void take_shouldReturnValueExactlyOnce() {
        store.put("reset:abc", "alice", Duration.ofHours(1)).block();

        StepVerifier.create(store.take("reset:abc")).expectNext("alice").verifyComplete();
        StepVerifier.create(store.take("reset:abc")).verifyComplete();
    }

    @Test
    void take_shouldYieldSingleWinner_underConcurrentCallers() {
        store.put("reset:abc", "alice", Duration.ofHours(1)).block();

        Long winners = Flux.range(0, 32)
                .flatMap(i -> store.take("reset:abc").subscribeOn(Schedulers.parallel()))
                .count()
                .block();

        assertThat(winners).isEqualTo(1L);
    }

    @Test
    void take_shouldReturnEmpty_whenExpired() {
        store.put("reset:abc", "alice", Duration.ofMinutes(1)).block();
        clock.advance(Duration.ofMinutes(2));

        StepVerifier.create(store.take("reset:abc")).verifyComplete();
    }

    @Test
    void recordAttempt_shouldAllowUpToMax_thenReportRetryAfter() {
        Duration window = Duration.ofMinutes(1);
        for (int i = 1; i <= 3; i++) {
            int expected = i;
            StepVerifier.create(store.recordAttempt("rl", 3, window))
                    .assertNext(result -> {
                        assertThat(result.allowed()).isTrue();
                        assertThat(result.count()).isEqualTo(expected);
                    })
                    .verifyComplete();
            clock.advance(Duration.ofSeconds(10));
        }

        StepVerifier.create(store.recordAttempt("rl", 3, window))
                .assertNext(result -> {
                    assertThat(result.allowed()).isFalse();
                    assertThat(result.retryAfter()).isEqualTo(Duration.ofSeconds(30));
                })
                .verifyComplete();
    }

    @Test
    void recordAttempt_shouldSlide_whenOldestAttemptLeavesWindow() {
        Duration window = Duration.ofMinutes(1);
        store.recordAttempt("rl", 2, window).block();
        clock.advance(Duration.ofSeconds(30));
        store.recordAttempt("rl", 2, window).block();

        clock.advance(Duration.ofSeconds(31));

        StepVerifier.create(store.recordAttempt("rl", 2, window))
                .assertNext(result -> {
                    assertThat(result.allowed()).isTrue();
                    assertThat(result.count()).isEqualTo(2);
                })
                .verifyComplete();
    }

    @Test
    void recordAttempt_shouldNotCountRejectedAttempts() {
        Duration window = Duration.ofMinutes(1);
        store.recordAttempt("rl", 1, window).block();
        store.recordAttempt("rl", 1, window).block();
        store.recordAttempt("rl", 1, window).block();

        clock.advance(Duration.ofSeconds(61));

        StepVerifier.create(store.recordAttempt("rl", 1, window))
                .assertNext(result -> assertThat(result.allowed()).isTrue())
                .verifyComplete();
    }

    @Test
    void recordAttempt_shouldAllowExactlyMax_underConcurrentCallers() throws Exception {
        int callers = 64;
        int maxAttempts = 5;
        Duration window = Duration.ofMinutes(1);
        ExecutorService pool = Executors.newFixedThreadPool(16);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<SlidingWindowResult>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return store.recordAttempt("login:alice", maxAttempts, window).block();
                }));
            }
            start.countDown();

            int allowed = 0;
            for (Future<SlidingWindowResult> future : futures) {
                if (future.get(10, TimeUnit.SECONDS).allowed()) {
                    allowed++;
                }
            }

            assertThat(allowed).isEqualTo(maxAttempts);
        } finally {
            pool.shutdownNow();
        }

        StepVerifier.create(store.recordAttempt("login:alice", maxAttempts, window))
                .assertNext(result -> assertThat(result.count()).isEqualTo(maxAttempts))
                .verifyComplete();
    }

    @Test
    void recordAttempt_shouldRejectNonPositiveLimit() {
        StepVerifier.create(store.recordAttempt("rl", 0, Duration.ofMinutes(1)))
                .expectError(IllegalArgumentException.class)
                .verify();
    }
}
