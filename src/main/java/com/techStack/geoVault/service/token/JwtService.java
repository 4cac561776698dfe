package com.techStack.geoVault.service.token;

import com.techStack.geoVault.config.security.JwtConfig;
import com.techStack.geoVault.constants.SecurityConstants;
import com.techStack.geoVault.exception.auth.InvalidTokenException;
import com.techStack.geoVault.models.auth.TokenClaims;
import com.techStack.geoVault.models.auth.TokenType;
import com.techStack.geoVault.models.user.Roles;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * Issues and verifies HS512 tokens. Every token carries a {@code type} claim and a {@code jti};
 * verification for one type rejects tokens of any other type.
 */
@Slf4j
@Service
public class JwtService {

    private final JwtConfig jwtConfig;
    private final SecretKey signingKey;
    private final Clock clock;
    private final JwtParser parser;

    public JwtService(JwtConfig jwtConfig, SecretKey jwtSigningKey, Clock clock) {
        this.jwtConfig = jwtConfig;
        this.signingKey = jwtSigningKey;
        this.clock = clock;
        this.parser = Jwts.parserBuilder()
                .setSigningKey(jwtSigningKey)
                .setAllowedClockSkewSeconds(jwtConfig.getClockSkewSeconds())
                .setClock(() -> Date.from(clock.instant()))
                .requireIssuer(jwtConfig.getIssuer())
                .build();
    }

    /* ===== Issue ===== */

    public String generateToken(String subject, Roles role, TokenType type) {
        Instant issuedAt = clock.instant();
        Instant expiresAt = issuedAt.plusSeconds(jwtConfig.expirationSecondsFor(type));

        var builder = Jwts.builder()
                .setId(UUID.randomUUID().toString())
                .setSubject(subject)
                .setIssuer(jwtConfig.getIssuer())
                .setIssuedAt(Date.from(issuedAt))
                .setExpiration(Date.from(expiresAt))
                .claim(SecurityConstants.CLAIM_TYPE, type.name());

        if (role != null) {
            builder.claim(SecurityConstants.CLAIM_ROLE, role.name());
        }

        return builder.signWith(signingKey, SignatureAlgorithm.HS512).compact();
    }

    /* ===== Verify ===== */

    /**
     * Verifies signature, expiry, issuer and type. Does not consult the revocation set.
     *
     * @throws InvalidTokenException on any failure
     */
    public TokenClaims parse(String token, TokenType expectedType) {
        if (StringUtils.isBlank(token)) {
            throw new InvalidTokenException("Token is missing");
        }

        Claims claims;
        try {
            claims = parser.parseClaimsJws(token).getBody();
        } catch (ExpiredJwtException e) {
            throw new InvalidTokenException("Token has expired");
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected {} token: {}", expectedType, e.getMessage());
            throw new InvalidTokenException("Invalid token");
        }

        String type = claims.get(SecurityConstants.CLAIM_TYPE, String.class);
        if (!expectedType.name().equals(type)) {
            throw new InvalidTokenException("Invalid token type");
        }
        if (StringUtils.isAnyBlank(claims.getId(), claims.getSubject())) {
            throw new InvalidTokenException("Invalid token");
        }

        return TokenClaims.builder()
                .tokenId(claims.getId())
                .subject(claims.getSubject())
                .role(Roles.fromString(claims.get(SecurityConstants.CLAIM_ROLE, String.class)))
                .type(expectedType)
                .issuedAt(claims.getIssuedAt().toInstant())
                .expiresAt(claims.getExpiration().toInstant())
                .build();
    }

    public Mono<TokenClaims> validateToken(String token, TokenType expectedType) {
        return Mono.fromCallable(() -> parse(token, expectedType));
    }

    public long expirationSeconds(TokenType type) {
        return jwtConfig.expirationSecondsFor(type);
    }
}
