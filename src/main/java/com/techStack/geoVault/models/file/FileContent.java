package com.techStack.geoVault.models.file;

/**
 * Decrypted file ready to be streamed back to the caller.
 */
public record FileContent(String filename, String mediaType, byte[] bytes) {
}
