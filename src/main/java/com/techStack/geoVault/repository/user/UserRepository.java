package com.techStack.geoVault.repository.user;

import com.techStack.geoVault.models.user.Roles;
import com.techStack.geoVault.models.user.User;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface UserRepository {

    Mono<User> findByUsername(String username);

    Mono<User> findByEmail(String email);

    Flux<User> findByRole(Roles role);

    Mono<User> save(User user);

    Mono<Void> deleteByUsername(String username);
}
