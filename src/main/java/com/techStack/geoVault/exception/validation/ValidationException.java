package com.techStack.geoVault.exception.validation;

import com.techStack.geoVault.exception.service.CustomException;
import org.springframework.http.HttpStatus;

public class ValidationException extends CustomException {
    public ValidationException(String field, String message) {
        super(HttpStatus.BAD_REQUEST, message, field, "VALIDATION_FAILED");
    }
}
