package com.techStack.geoVault.models.audit;

public enum AccessAction {
    ACCESS,
    DENIED,
    UPLOAD,
    DELETE
}
