package com.techStack.geoVault.config.security;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Sliding-window limits for login attempts (per username) and general API traffic (per client IP).
 */
@Validated
@ConfigurationProperties(prefix = "security.rate-limit")
@Getter
@Setter
public class RateLimitProperties {

    @Valid
    private Limit login = new Limit(true, 5, Duration.ofMinutes(15));

    @Valid
    private Limit api = new Limit(true, 120, Duration.ofMinutes(1));

    @Getter
    @Setter
    public static class Limit {
        private boolean enabled;

        @Positive
        private int maxAttempts;

        private Duration window;

        public Limit() {
        }

        public Limit(boolean enabled, int maxAttempts, Duration window) {
            this.enabled = enabled;
            this.maxAttempts = maxAttempts;
            this.window = window;
        }
    }
}
