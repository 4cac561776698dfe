package com.techStack.geoVault.repository.wfh;

import com.google.cloud.firestore.Firestore;
import com.techStack.geoVault.constants.SecurityConstants;
import com.techStack.geoVault.models.wfh.WfhGrant;
import com.techStack.geoVault.repository.support.FirestoreRepositorySupport;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public class FirestoreWfhGrantRepository extends FirestoreRepositorySupport implements WfhGrantRepository {

    public FirestoreWfhGrantRepository(Firestore firestore) {
        super(firestore);
    }

    @Override
    protected String collectionName() {
        return SecurityConstants.COLLECTION_WFH_GRANTS;
    }

    @Override
    public Mono<WfhGrant> save(WfhGrant grant) {
        return setDocument(grant.getId(), grant.toMap()).thenReturn(grant);
    }

    @Override
    public Flux<WfhGrant> findByUsername(String username) {
        return query(collection().whereEqualTo("username", username), WfhGrant::fromMap);
    }

    @Override
    public Flux<WfhGrant> findAll() {
        return query(collection(), WfhGrant::fromMap);
    }
}
