package com.techStack.geoVault.models.crypto;

/**
 * {@code encapsulatedKey} is safe to transmit; {@code sharedSecret} never leaves the process.
 */
public record Encapsulation(byte[] encapsulatedKey, byte[] sharedSecret) {

    @Override
    public String toString() {
        return "Encapsulation{encapsulatedKey=" + encapsulatedKey.length + " bytes, sharedSecret=[REDACTED]}";
    }
}
