package com.techStack.geoVault.repository.audit;

import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Query;
import com.techStack.geoVault.constants.SecurityConstants;
import com.techStack.geoVault.models.audit.AccessDecisionLog;
import com.techStack.geoVault.repository.support.FirestoreRepositorySupport;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public class FirestoreAccessLogRepository extends FirestoreRepositorySupport implements AccessLogRepository {

    public FirestoreAccessLogRepository(Firestore firestore) {
        super(firestore);
    }

    @Override
    protected String collectionName() {
        return SecurityConstants.COLLECTION_ACCESS_LOGS;
    }

    @Override
    public Mono<AccessDecisionLog> append(AccessDecisionLog entry) {
        // create() fails if the id already exists, so entries are never overwritten
        return call("create", () -> collection().document(entry.getId()).create(entry.toMap()))
                .thenReturn(entry);
    }

    @Override
    public Flux<AccessDecisionLog> findRecent(int limit) {
        return query(collection().orderBy("timestamp", Query.Direction.DESCENDING).limit(limit),
                AccessDecisionLog::fromMap);
    }

    @Override
    public Mono<Long> count() {
        return count(collection());
    }
}
