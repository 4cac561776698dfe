package com.techStack.geoVault.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.techStack.geoVault.models.auth.IssuedTokens;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Returned after OTP verification and refresh. Tokens are also set as HttpOnly cookies;
 * the body copy is for non-browser clients.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuthResponse {

    private String username;
    private String role;
    private String accessToken;
    private String refreshToken;

    @Builder.Default
    private String tokenType = "Bearer";

    private long expiresIn;
    private long refreshExpiresIn;
    private String csrfToken;

    public static AuthResponse from(IssuedTokens tokens, String csrfToken) {
        return AuthResponse.builder()
                .username(tokens.username())
                .role(tokens.role().name())
                .accessToken(tokens.accessToken())
                .refreshToken(tokens.refreshToken())
                .expiresIn(tokens.accessExpiresIn())
                .refreshExpiresIn(tokens.refreshExpiresIn())
                .csrfToken(csrfToken)
                .build();
    }
}
