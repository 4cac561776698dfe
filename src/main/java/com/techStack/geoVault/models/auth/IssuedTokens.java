package com.techStack.geoVault.models.auth;

import com.techStack.geoVault.models.user.Roles;
import lombok.Builder;

@Builder
public record IssuedTokens(
        String username,
        Roles role,
        String accessToken,
        String refreshToken,
        long accessExpiresIn,
        long refreshExpiresIn
) {
}
