package com.techStack.geoVault.models.user;

/**
 * The two principal roles. Authority strings carry the Spring {@code ROLE_} prefix.
 */
public enum Roles {
    ADMIN,
    EMPLOYEE;

    public String authority() {
        return "ROLE_" + name();
    }

    public static Roles fromString(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Roles.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
