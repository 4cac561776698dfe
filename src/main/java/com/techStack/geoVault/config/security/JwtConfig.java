package com.techStack.geoVault.config.security;

import com.techStack.geoVault.models.auth.TokenType;
import io.jsonwebtoken.security.Keys;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

@Validated
@Configuration
@ConfigurationProperties(prefix = "jwt")
@Getter
@Setter
public class JwtConfig {

    @NotBlank(message = "jwt.secret must not be blank")
    private String secret;

    @Positive(message = "jwt.access-token-expiration must be positive")
    private long accessTokenExpiration = 1800; // seconds

    @Positive(message = "jwt.refresh-token-expiration must be positive")
    private long refreshTokenExpiration = 604800; // 7 days

    @Positive(message = "jwt.reset-token-expiration must be positive")
    private long resetTokenExpiration = 3600;

    @Positive(message = "jwt.csrf-token-expiration must be positive")
    private long csrfTokenExpiration = 3600;

    @Positive(message = "jwt.clock-skew-seconds must be positive")
    private long clockSkewSeconds = 30;

    private String issuer = "geoVault";

    @Bean
    public SecretKey jwtSigningKey() {
        return validateAndCreateKey(secret, "jwt.secret");
    }

    /**
     * Accepts either a Base64 value or raw text; HS512 needs at least 64 bytes either way.
     */
    static SecretKey validateAndCreateKey(String keyString, String propertyName) {
        if (keyString == null || keyString.isBlank()) {
            throw new IllegalArgumentException(propertyName + " must not be null or empty");
        }

        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(keyString);
        } catch (IllegalArgumentException e) {
            keyBytes = keyString.getBytes(StandardCharsets.UTF_8);
        }

        if (keyBytes.length < 64) {
            throw new IllegalArgumentException(
                    String.format("%s must be at least 512 bits (64 bytes). Current size: %d bits",
                            propertyName, keyBytes.length * 8));
        }

        return Keys.hmacShaKeyFor(keyBytes);
    }

    public long expirationSecondsFor(TokenType type) {
        return switch (type) {
            case ACCESS -> accessTokenExpiration;
            case REFRESH -> refreshTokenExpiration;
            case RESET -> resetTokenExpiration;
            case CSRF -> csrfTokenExpiration;
        };
    }
}
