package com.techStack.geoVault.repository.support;

import com.google.api.core.ApiFuture;
import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Query;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.QuerySnapshot;
import com.techStack.geoVault.exception.service.CustomException;
import com.techStack.geoVault.util.FirestoreUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Common plumbing for Firestore-backed repositories: timeouts, a short retry on transient
 * failures, and mapping of documents through the model's {@code fromMap}.
 */
@Slf4j
public abstract class FirestoreRepositorySupport {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    protected final Firestore firestore;

    protected FirestoreRepositorySupport(Firestore firestore) {
        this.firestore = firestore;
    }

    protected abstract String collectionName();

    protected CollectionReference collection() {
        return firestore.collection(collectionName());
    }

    protected <T> Mono<T> call(String operation, Supplier<ApiFuture<T>> future) {
        return FirestoreUtil.toMono(future)
                .timeout(TIMEOUT)
                .retryWhen(Retry.backoff(2, Duration.ofMillis(100))
                        .filter(e -> !(e instanceof TimeoutException))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .onErrorMap(e -> !(e instanceof CustomException), e -> {
                    log.error("❌ Firestore {} on {} failed: {}", operation, collectionName(), e.getMessage());
                    return new CustomException(HttpStatus.SERVICE_UNAVAILABLE,
                            "Storage temporarily unavailable", e);
                });
    }

    protected <T> Mono<T> getDocument(String id, Function<Map<String, Object>, T> mapper) {
        return call("get", () -> collection().document(id).get())
                .filter(DocumentSnapshot::exists)
                .map(snapshot -> mapper.apply(snapshot.getData()));
    }

    protected Mono<Void> setDocument(String id, Map<String, Object> data) {
        return call("set", () -> collection().document(id).set(data)).then();
    }

    protected Mono<Void> deleteDocument(String id) {
        return call("delete", () -> collection().document(id).delete()).then();
    }

    protected <T> Flux<T> query(Query query, Function<Map<String, Object>, T> mapper) {
        return call("query", query::get)
                .flatMapIterable(QuerySnapshot::getDocuments)
                .map(QueryDocumentSnapshot::getData)
                .map(mapper);
    }

    protected Mono<Long> count(Query query) {
        return call("count", () -> query.count().get())
                .map(snapshot -> snapshot.getCount());
    }
}
