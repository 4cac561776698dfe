package com.techStack.geoVault.repository.audit;

import com.techStack.geoVault.models.audit.AccessDecisionLog;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Append-only store of access decisions.
 */
public interface AccessLogRepository {

    Mono<AccessDecisionLog> append(AccessDecisionLog entry);

    /** Newest first. */
    Flux<AccessDecisionLog> findRecent(int limit);

    Mono<Long> count();
}
