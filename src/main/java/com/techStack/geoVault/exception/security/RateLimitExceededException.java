package com.techStack.geoVault.exception.security;

import com.techStack.geoVault.exception.service.CustomException;
import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.time.Duration;

/**
 * Rate limit exceeded exception
 */
@Getter
public class RateLimitExceededException extends CustomException {
    private final long retryAfterSeconds;

    public RateLimitExceededException(String message, Duration retryAfter) {
        super(HttpStatus.TOO_MANY_REQUESTS, message, null, "RATE_LIMIT_EXCEEDED");
        this.retryAfterSeconds = Math.max(1, retryAfter.toSeconds());
    }

    public RateLimitExceededException(Duration retryAfter) {
        this("Too many attempts. Please wait " + Math.max(1, retryAfter.toSeconds())
                + " seconds and try again.", retryAfter);
    }
}
