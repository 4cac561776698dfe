package com.techStack.geoVault.support;

import com.techStack.geoVault.models.audit.AccessDecisionLog;
import com.techStack.geoVault.repository.audit.AccessLogRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryAccessLogRepository implements AccessLogRepository {

    private final List<AccessDecisionLog> entries = new CopyOnWriteArrayList<>();

    @Override
    public Mono<AccessDecisionLog> append(AccessDecisionLog entry) {
        return Mono.fromCallable(() -> {
            entries.add(entry);
            return entry;
        });
    }

    @Override
    public Flux<AccessDecisionLog> findRecent(int limit) {
        return Flux.defer(() -> Flux.fromIterable(new ArrayList<>(entries)))
                .sort(Comparator.comparing(AccessDecisionLog::getTimestamp).reversed())
                .take(limit);
    }

    @Override
    public Mono<Long> count() {
        return Mono.fromCallable(() -> (long) entries.size());
    }

    public List<AccessDecisionLog> entries() {
        return List.copyOf(entries);
    }
}
