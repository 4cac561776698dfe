package com.techStack.geoVault.models.auth;

public enum TokenType {
    ACCESS,
    REFRESH,
    RESET,
    CSRF
}
