package com.techStack.geoVault.exception.crypto;

public class DecapsulationException extends CryptoException {
    public DecapsulationException(String message) {
        super(message, null, "DECAPSULATION_FAILED");
    }

    public DecapsulationException(String message, Throwable cause) {
        super(message, cause, "DECAPSULATION_FAILED");
    }
}
