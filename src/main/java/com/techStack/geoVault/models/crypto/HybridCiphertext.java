package com.techStack.geoVault.models.crypto;

public record HybridCiphertext(byte[] encapsulatedKey, byte[] encryptedBlob, String algorithm, KemMode mode) {
}
