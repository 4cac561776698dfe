package com.techStack.geoVault.repository.file;

import com.google.cloud.firestore.Firestore;
import com.techStack.geoVault.constants.SecurityConstants;
import com.techStack.geoVault.models.file.FileMetadata;
import com.techStack.geoVault.repository.support.FirestoreRepositorySupport;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public class FirestoreFileMetadataRepository extends FirestoreRepositorySupport implements FileMetadataRepository {

    public FirestoreFileMetadataRepository(Firestore firestore) {
        super(firestore);
    }

    @Override
    protected String collectionName() {
        return SecurityConstants.COLLECTION_FILE_METADATA;
    }

    @Override
    public Mono<FileMetadata> save(FileMetadata metadata) {
        return setDocument(metadata.getFileId(), metadata.toMap()).thenReturn(metadata);
    }

    @Override
    public Mono<FileMetadata> findById(String fileId) {
        return getDocument(fileId, FileMetadata::fromMap);
    }

    @Override
    public Flux<FileMetadata> findAll() {
        return query(collection(), FileMetadata::fromMap);
    }

    @Override
    public Mono<Void> deleteById(String fileId) {
        return deleteDocument(fileId);
    }
}
