package com.techStack.geoVault.models.crypto;

/**
 * X.509-encoded public key for the given mode.
 */
public record KemPublicKey(KemMode mode, byte[] encoded) {
}
