package com.techStack.geoVault.util.validation;

import com.techStack.geoVault.exception.validation.ValidationException;

import java.nio.charset.StandardCharsets;

/**
 * Length bounds for new passwords. BCrypt only reads the first 72 bytes, so longer input is refused.
 */
public final class PasswordRules {

    public static final int MIN_LENGTH = 8;
    public static final int MAX_BYTES = 72;

    private PasswordRules() {
    }

    public static void validate(String field, String password) {
        if (password == null || password.length() < MIN_LENGTH) {
            throw new ValidationException(field, "Password must be at least " + MIN_LENGTH + " characters");
        }
        if (password.getBytes(StandardCharsets.UTF_8).length > MAX_BYTES) {
            throw new ValidationException(field, "Password must be at most " + MAX_BYTES + " bytes");
        }
        if (password.isBlank()) {
            throw new ValidationException(field, "Password must not be blank");
        }
    }
}
