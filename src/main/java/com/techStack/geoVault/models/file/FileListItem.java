package com.techStack.geoVault.models.file;

import lombok.Builder;

import java.time.Instant;
import java.util.Map;

@Builder
public record FileListItem(
        String fileId,
        String filename,
        String uploadedBy,
        Instant uploadedAt,
        long size,
        boolean accessible,
        String accessReason,
        Map<String, String> validations
) {
}
