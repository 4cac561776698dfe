package com.techStack.geoVault.repository.file;

import com.techStack.geoVault.models.file.FileMetadata;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface FileMetadataRepository {

    Mono<FileMetadata> save(FileMetadata metadata);

    Mono<FileMetadata> findById(String fileId);

    Flux<FileMetadata> findAll();

    Mono<Void> deleteById(String fileId);
}
