package com.techStack.geoVault.exception.resource;

import com.techStack.geoVault.exception.service.CustomException;
import org.springframework.http.HttpStatus;

public class ConflictException extends CustomException {
    public ConflictException(String field, String message) {
        super(HttpStatus.CONFLICT, message, field, "CONFLICT");
    }
}
