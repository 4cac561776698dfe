package com.techStack.geoVault.util;

import com.google.api.core.ApiFuture;
import com.google.cloud.Timestamp;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Bridges Firestore's {@link ApiFuture} into Reactor and converts between
 * {@link Instant} and Firestore {@link Timestamp}.
 */
public final class FirestoreUtil {

    private FirestoreUtil() {
    }

    public static <T> CompletableFuture<T> toCompletableFuture(ApiFuture<T> apiFuture) {
        CompletableFuture<T> completableFuture = new CompletableFuture<>();

        apiFuture.addListener(() -> {
            try {
                completableFuture.complete(apiFuture.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                completableFuture.completeExceptionally(e);
            } catch (ExecutionException e) {
                completableFuture.completeExceptionally(e.getCause());
            }
        }, Runnable::run);

        return completableFuture;
    }

    /**
     * Lazily subscribes to a Firestore call; the future is only created on subscription.
     */
    public static <T> Mono<T> toMono(Supplier<ApiFuture<T>> call) {
        return Mono.defer(() -> Mono.fromFuture(toCompletableFuture(call.get())))
                .subscribeOn(Schedulers.boundedElastic());
    }

    public static Timestamp toTimestamp(Instant instant) {
        if (instant == null) {
            return null;
        }
        return Timestamp.ofTimeSecondsAndNanos(instant.getEpochSecond(), instant.getNano());
    }

    public static Instant toInstant(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Timestamp timestamp) {
            return Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof String text) {
            return Instant.parse(text);
        }
        throw new IllegalArgumentException("Unsupported timestamp value: " + value.getClass().getName());
    }

    public static Double toDouble(Object value) {
        return value instanceof Number number ? number.doubleValue() : null;
    }

    public static long toLong(Object value) {
        return value instanceof Number number ? number.longValue() : 0L;
    }
}
