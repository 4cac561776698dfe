package com.techStack.geoVault.models.crypto;

/**
 * Which key-encapsulation primitive produced a value.
 */
public enum KemMode {
    POST_QUANTUM("kyber768"),
    CLASSICAL("x25519");

    private final String algorithmLabel;

    KemMode(String algorithmLabel) {
        this.algorithmLabel = algorithmLabel;
    }

    public String algorithmLabel() {
        return algorithmLabel;
    }

    public String hybridAlgorithm() {
        return "hybrid_" + algorithmLabel + "_aes256gcm";
    }
}
