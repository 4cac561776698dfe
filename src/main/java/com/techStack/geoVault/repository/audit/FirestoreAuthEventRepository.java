package com.techStack.geoVault.repository.audit;

import com.google.cloud.firestore.Firestore;
import com.techStack.geoVault.constants.SecurityConstants;
import com.techStack.geoVault.models.audit.AuthEventLog;
import com.techStack.geoVault.repository.support.FirestoreRepositorySupport;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public class FirestoreAuthEventRepository extends FirestoreRepositorySupport implements AuthEventRepository {

    public FirestoreAuthEventRepository(Firestore firestore) {
        super(firestore);
    }

    @Override
    protected String collectionName() {
        return SecurityConstants.COLLECTION_AUTH_EVENTS;
    }

    @Override
    public Mono<Void> append(AuthEventLog event) {
        return call("create", () -> collection().document(event.getId()).create(event.toMap())).then();
    }
}
