package com.techStack.geoVault.exception.crypto;

public class CryptoOperationException extends CryptoException {
    public CryptoOperationException(String message, Throwable cause) {
        super(message, cause, "CRYPTO_FAILURE");
    }
}
