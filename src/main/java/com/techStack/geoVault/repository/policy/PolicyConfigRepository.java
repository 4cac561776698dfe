package com.techStack.geoVault.repository.policy;

import com.techStack.geoVault.models.policy.AccessPolicy;
import reactor.core.publisher.Mono;

public interface PolicyConfigRepository {

    /** Empty when no policy has been stored yet. */
    Mono<AccessPolicy> findActive();

    Mono<AccessPolicy> save(AccessPolicy policy);
}
