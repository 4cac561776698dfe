package com.techStack.geoVault.config.bootstrap;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "bootstrap.admin")
@Getter
@Setter
public class BootstrapProperties {
    private boolean enabled = true;
    private String username = "admin";
    private String email = "admin@geovault.local";
    private String password;
}
