package com.techStack.geoVault.support;

import com.techStack.geoVault.repository.file.EncryptedObjectStore;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryEncryptedObjectStore implements EncryptedObjectStore {

    private final Map<String, byte[]> objects = new ConcurrentHashMap<>();
    private volatile boolean failDeletes;

    @Override
    public Mono<Void> put(String fileId, byte[] ciphertext) {
        return Mono.fromRunnable(() -> objects.put(fileId, ciphertext.clone()));
    }

    @Override
    public Mono<byte[]> get(String fileId) {
        return Mono.fromCallable(() -> {
            byte[] stored = objects.get(fileId);
            return stored == null ? null : stored.clone();
        });
    }

    @Override
    public Mono<Void> delete(String fileId) {
        return Mono.defer(() -> failDeletes
                ? Mono.error(new IllegalStateException("object store unavailable"))
                : Mono.fromRunnable(() -> objects.remove(fileId)));
    }

    public byte[] raw(String fileId) {
        return objects.get(fileId);
    }

    public void replace(String fileId, byte[] ciphertext) {
        objects.put(fileId, ciphertext);
    }

    public boolean contains(String fileId) {
        return objects.containsKey(fileId);
    }

    public void failDeletes(boolean fail) {
        this.failDeletes = fail;
    }
}
