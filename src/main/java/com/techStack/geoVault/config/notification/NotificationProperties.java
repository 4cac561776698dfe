package com.techStack.geoVault.config.notification;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification")
@Getter
@Setter
public class NotificationProperties {
    private String from = "no-reply@geovault.local";
    private String appName = "GeoVault";
    /** Base of the link sent in password reset emails; the token is appended as a query parameter. */
    private String resetLinkBase = "http://localhost:3000/reset-password";
}
