package com.techStack.geoVault.repository.user;

import com.google.cloud.firestore.Firestore;
import com.techStack.geoVault.constants.SecurityConstants;
import com.techStack.geoVault.models.user.Roles;
import com.techStack.geoVault.models.user.User;
import com.techStack.geoVault.repository.support.FirestoreRepositorySupport;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Users keyed by username in the {@code users} collection.
 */
@Repository
public class FirestoreUserRepository extends FirestoreRepositorySupport implements UserRepository {

    public FirestoreUserRepository(Firestore firestore) {
        super(firestore);
    }

    @Override
    protected String collectionName() {
        return SecurityConstants.COLLECTION_USERS;
    }

    @Override
    public Mono<User> findByUsername(String username) {
        return getDocument(username, User::fromMap);
    }

    @Override
    public Mono<User> findByEmail(String email) {
        return query(collection().whereEqualTo("email", email).limit(1), User::fromMap).next();
    }

    @Override
    public Flux<User> findByRole(Roles role) {
        return query(collection().whereEqualTo("role", role.name()), User::fromMap);
    }

    @Override
    public Mono<User> save(User user) {
        return setDocument(user.getUsername(), user.toMap()).thenReturn(user);
    }

    @Override
    public Mono<Void> deleteByUsername(String username) {
        return deleteDocument(username);
    }
}
