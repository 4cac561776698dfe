package com.techStack.geoVault.models.crypto;

import lombok.Builder;

@Builder
public record CryptoCapabilities(
        boolean postQuantumAvailable,
        KemMode activeMode,
        String kemAlgorithm,
        String symmetricCipher,
        int keySizeBits,
        int nonceSizeBytes,
        int tagSizeBytes,
        String keyDerivation,
        String hybridAlgorithm
) {
}
