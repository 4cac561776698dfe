package com.techStack.geoVault.support;

import com.techStack.geoVault.config.security.JwtConfig;
import com.techStack.geoVault.config.security.OtpProperties;
import com.techStack.geoVault.service.security.OtpService;
import com.techStack.geoVault.service.token.JwtService;

import java.time.Clock;

/**
 * Factories for services that need secrets.
 */
public final class TestSecurity {

    public static final String JWT_SECRET =
            "test-only-signing-secret-for-geovault-unit-tests-0123456789-abcdefghijklmnop";

    private TestSecurity() {
    }

    public static JwtConfig jwtConfig() {
        JwtConfig config = new JwtConfig();
        config.setSecret(JWT_SECRET);
        return config;
    }

    public static JwtService jwtService(Clock clock) {
        JwtConfig config = jwtConfig();
        return new JwtService(config, config.jwtSigningKey(), clock);
    }

    public static OtpService otpService() {
        OtpProperties properties = new OtpProperties();
        properties.setHashSecret("test-otp-hash-secret");
        return new OtpService(properties);
    }
}
