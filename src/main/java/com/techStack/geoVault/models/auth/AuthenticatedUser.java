package com.techStack.geoVault.models.auth;

import com.techStack.geoVault.models.user.Roles;

import java.security.Principal;
import java.time.Instant;

/**
 * Principal established from a verified, unrevoked access token.
 */
public record AuthenticatedUser(String username, Roles role, String tokenId, Instant expiresAt) implements Principal {

    @Override
    public String getName() {
        return username;
    }

    public boolean isAdmin() {
        return role == Roles.ADMIN;
    }
}
