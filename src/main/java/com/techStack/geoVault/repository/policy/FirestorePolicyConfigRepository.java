package com.techStack.geoVault.repository.policy;

import com.google.cloud.firestore.Firestore;
import com.techStack.geoVault.constants.SecurityConstants;
import com.techStack.geoVault.models.policy.AccessPolicy;
import com.techStack.geoVault.repository.support.FirestoreRepositorySupport;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public class FirestorePolicyConfigRepository extends FirestoreRepositorySupport implements PolicyConfigRepository {

    public FirestorePolicyConfigRepository(Firestore firestore) {
        super(firestore);
    }

    @Override
    protected String collectionName() {
        return SecurityConstants.COLLECTION_POLICY_CONFIG;
    }

    @Override
    public Mono<AccessPolicy> findActive() {
        return getDocument(SecurityConstants.ACTIVE_POLICY_DOC_ID, AccessPolicy::fromMap);
    }

    @Override
    public Mono<AccessPolicy> save(AccessPolicy policy) {
        return setDocument(SecurityConstants.ACTIVE_POLICY_DOC_ID, policy.toMap()).thenReturn(policy);
    }
}
