package com.techStack.geoVault.models.auth;

import com.techStack.geoVault.models.user.Roles;
import lombok.Builder;

import java.time.Duration;
import java.time.Instant;

/**
 * Verified claims of a signed token.
 */
@Builder
public record TokenClaims(
        String tokenId,
        String subject,
        Roles role,
        TokenType type,
        Instant issuedAt,
        Instant expiresAt
) {
    public Duration remainingLifetime(Instant now) {
        Duration remaining = Duration.between(now, expiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
}
