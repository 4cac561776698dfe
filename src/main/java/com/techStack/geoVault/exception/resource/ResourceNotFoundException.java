package com.techStack.geoVault.exception.resource;

import com.techStack.geoVault.exception.service.CustomException;
import org.springframework.http.HttpStatus;

public class ResourceNotFoundException extends CustomException {
    public ResourceNotFoundException(String resource, String id) {
        super(HttpStatus.NOT_FOUND, resource + " not found", null, "NOT_FOUND");
    }
}
