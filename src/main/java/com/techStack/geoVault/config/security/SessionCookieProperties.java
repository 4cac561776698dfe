package com.techStack.geoVault.config.security;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "session.cookie")
@Getter
@Setter
public class SessionCookieProperties {
    private boolean secure = true;
    private String sameSite = "Strict";
    private String path = "/";
}
