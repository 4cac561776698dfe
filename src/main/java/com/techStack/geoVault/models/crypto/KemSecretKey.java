package com.techStack.geoVault.models.crypto;

/**
 * PKCS#8-encoded private key for the given mode.
 */
public record KemSecretKey(KemMode mode, byte[] encoded) {

    @Override
    public String toString() {
        return "KemSecretKey{mode=" + mode + ", encoded=[REDACTED]}";
    }
}
