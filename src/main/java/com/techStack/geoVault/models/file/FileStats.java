package com.techStack.geoVault.models.file;

public record FileStats(long totalFiles, long totalBytes, long totalAccessLogs) {
}
