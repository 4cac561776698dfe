package com.techStack.geoVault.support;

import com.techStack.geoVault.models.file.FileMetadata;
import com.techStack.geoVault.repository.file.FileMetadataRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryFileMetadataRepository implements FileMetadataRepository {

    private final Map<String, FileMetadata> files = new ConcurrentHashMap<>();

    @Override
    public Mono<FileMetadata> save(FileMetadata metadata) {
        return Mono.fromCallable(() -> {
            files.put(metadata.getFileId(), metadata);
            return metadata;
        });
    }

    @Override
    public Mono<FileMetadata> findById(String fileId) {
        return Mono.fromCallable(() -> files.get(fileId));
    }

    @Override
    public Flux<FileMetadata> findAll() {
        return Flux.defer(() -> Flux.fromIterable(new ArrayList<>(files.values())));
    }

    @Override
    public Mono<Void> deleteById(String fileId) {
        return Mono.fromRunnable(() -> files.remove(fileId));
    }

    public boolean contains(String fileId) {
        return files.containsKey(fileId);
    }
}
