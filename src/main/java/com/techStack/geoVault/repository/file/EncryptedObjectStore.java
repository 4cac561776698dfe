package com.techStack.geoVault.repository.file;

import reactor.core.publisher.Mono;

/**
 * Opaque ciphertext storage keyed by file id.
 */
public interface EncryptedObjectStore {

    Mono<Void> put(String fileId, byte[] ciphertext);

    /** Empty when no object exists for {@code fileId}. */
    Mono<byte[]> get(String fileId);

    Mono<Void> delete(String fileId);
}
