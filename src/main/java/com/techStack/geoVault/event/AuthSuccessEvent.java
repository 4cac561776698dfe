package com.techStack.geoVault.event;

import com.techStack.geoVault.models.user.User;
import lombok.AccessLevel;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.time.Instant;

/**
 * Published when a user completes OTP verification.
 */
@Getter
public class AuthSuccessEvent extends ApplicationEvent {

    private final User user;
    private final String ipAddress;
    @Getter(AccessLevel.NONE)
    private final Instant timestamp;

    public AuthSuccessEvent(User user, String ipAddress, Instant timestamp) {
        super(user);
        this.user = user;
        this.ipAddress = ipAddress;
        this.timestamp = timestamp;
    }

    @Override
    public String toString() {
        return "AuthSuccessEvent{" +
                "username='" + user.getUsername() + '\'' +
                ", ipAddress='" + ipAddress + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }
}
