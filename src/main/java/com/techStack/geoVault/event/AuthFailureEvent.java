package com.techStack.geoVault.event;

import lombok.AccessLevel;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.time.Instant;

/**
 * Published for every rejected login or OTP attempt. {@code reason} is internal only.
 */
@Getter
public class AuthFailureEvent extends ApplicationEvent {

    private final String username;
    private final String ipAddress;
    private final String reason;
    @Getter(AccessLevel.NONE)
    private final Instant timestamp;

    public AuthFailureEvent(String username, String ipAddress, String reason, Instant timestamp) {
        super(username);
        this.username = username;
        this.ipAddress = ipAddress;
        this.reason = reason;
        this.timestamp = timestamp;
    }
}
