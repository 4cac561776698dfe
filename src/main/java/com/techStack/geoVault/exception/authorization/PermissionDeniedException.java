package com.techStack.geoVault.exception.authorization;

import com.techStack.geoVault.exception.service.CustomException;
import org.springframework.http.HttpStatus;

public class PermissionDeniedException extends CustomException {
    public PermissionDeniedException(String message) {
        super(HttpStatus.FORBIDDEN, message, null, "PERMISSION_DENIED");
    }
}
