package com.techStack.geoVault.models.auth;

import com.techStack.geoVault.models.user.Roles;

import java.time.Instant;

/**
 * Returned after a successful password check; never carries the code itself.
 */
public record OtpChallenge(String username, Roles role, Instant expiresAt) {
}
