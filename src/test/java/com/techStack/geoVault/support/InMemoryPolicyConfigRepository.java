package com.techStack.geoVault.support;

import com.techStack.geoVault.models.policy.AccessPolicy;
import com.techStack.geoVault.repository.policy.PolicyConfigRepository;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicReference;

public class InMemoryPolicyConfigRepository implements PolicyConfigRepository {

    private final AtomicReference<AccessPolicy> active = new AtomicReference<>();

    @Override
    public Mono<AccessPolicy> findActive() {
        return Mono.fromCallable(active::get);
    }

    @Override
    public Mono<AccessPolicy> save(AccessPolicy policy) {
        return Mono.fromCallable(() -> {
            active.set(policy);
            return policy;
        });
    }
}
