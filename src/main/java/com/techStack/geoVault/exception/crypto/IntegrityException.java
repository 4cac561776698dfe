package com.techStack.geoVault.exception.crypto;

public class IntegrityException extends CryptoException {
    public IntegrityException(String message) {
        super(message, null, "INTEGRITY_CHECK_FAILED");
    }

    public IntegrityException(String message, Throwable cause) {
        super(message, cause, "INTEGRITY_CHECK_FAILED");
    }
}
