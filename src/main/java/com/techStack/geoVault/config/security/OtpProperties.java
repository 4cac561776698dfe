package com.techStack.geoVault.config.security;

import com.techStack.geoVault.constants.SecurityConstants;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "otp")
@Getter
@Setter
public class OtpProperties {

    /** HMAC key for stored OTP hashes. */
    @NotBlank(message = "otp.hash-secret must not be blank")
    private String hashSecret;

    private Duration ttl = SecurityConstants.OTP_TTL;

    private Duration resendCooldown = SecurityConstants.OTP_RESEND_COOLDOWN;

    /** Verification attempts allowed per username within one OTP lifetime. */
    @Min(value = 1, message = "otp.max-verify-attempts must be at least 1")
    private int maxVerifyAttempts = 5;
}
