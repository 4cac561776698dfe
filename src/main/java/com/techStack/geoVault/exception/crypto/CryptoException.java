package com.techStack.geoVault.exception.crypto;

import com.techStack.geoVault.exception.service.CustomException;
import org.springframework.http.HttpStatus;

/**
 * Root of all crypto failures. Always fatal to the enclosing operation and
 * rendered to callers as a generic internal error.
 */
public class CryptoException extends CustomException {
    public CryptoException(String message, Throwable cause, String code) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message, cause, null, code);
    }
}
