package com.techStack.geoVault.repository.wfh;

import com.techStack.geoVault.models.wfh.WfhGrant;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface WfhGrantRepository {

    Mono<WfhGrant> save(WfhGrant grant);

    Flux<WfhGrant> findByUsername(String username);

    Flux<WfhGrant> findAll();
}
