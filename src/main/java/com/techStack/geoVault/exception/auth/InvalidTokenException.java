package com.techStack.geoVault.exception.auth;

import com.techStack.geoVault.exception.service.CustomException;
import org.springframework.http.HttpStatus;

public class InvalidTokenException extends CustomException {
    public InvalidTokenException(String message) {
        super(HttpStatus.UNAUTHORIZED, message, null, "INVALID_TOKEN");
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(HttpStatus.UNAUTHORIZED, message, cause, null, "INVALID_TOKEN");
    }
}
