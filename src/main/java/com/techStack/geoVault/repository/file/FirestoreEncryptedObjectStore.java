package com.techStack.geoVault.repository.file;

import com.google.cloud.firestore.Blob;
import com.google.cloud.firestore.Firestore;
import com.techStack.geoVault.constants.SecurityConstants;
import com.techStack.geoVault.repository.support.FirestoreRepositorySupport;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Stores each ciphertext as a single Firestore document holding a bytes field,
 * which bounds objects to Firestore's 1 MiB document limit.
 */
@Repository
public class FirestoreEncryptedObjectStore extends FirestoreRepositorySupport implements EncryptedObjectStore {

    private static final String FIELD_CONTENT = "content";

    public FirestoreEncryptedObjectStore(Firestore firestore) {
        super(firestore);
    }

    @Override
    protected String collectionName() {
        return SecurityConstants.COLLECTION_ENCRYPTED_OBJECTS;
    }

    @Override
    public Mono<Void> put(String fileId, byte[] ciphertext) {
        Map<String, Object> data = new HashMap<>();
        data.put("fileId", fileId);
        data.put(FIELD_CONTENT, Blob.fromBytes(ciphertext));
        data.put("length", ciphertext.length);
        return setDocument(fileId, data);
    }

    @Override
    public Mono<byte[]> get(String fileId) {
        return getDocument(fileId, data -> ((Blob) data.get(FIELD_CONTENT)).toBytes());
    }

    @Override
    public Mono<Void> delete(String fileId) {
        return deleteDocument(fileId);
    }
}
