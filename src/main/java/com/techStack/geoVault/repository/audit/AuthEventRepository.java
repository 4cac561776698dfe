package com.techStack.geoVault.repository.audit;

import com.techStack.geoVault.models.audit.AuthEventLog;
import reactor.core.publisher.Mono;

public interface AuthEventRepository {

    Mono<Void> append(AuthEventLog event);
}
