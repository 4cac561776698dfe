package com.techStack.geoVault.config.policy;

import com.techStack.geoVault.models.policy.AccessPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;

@ConfigurationProperties(prefix = "policy")
@Getter
@Setter
public class PolicyProperties {

    public enum NetworkMatch { SUBSTRING, EXACT }

    /** Zone in which the allowed time window is interpreted. Blank means system default. */
    private String zoneId;

    private NetworkMatch networkMatch = NetworkMatch.SUBSTRING;

    /** Policy used when none has been stored yet. */
    private Defaults defaults = new Defaults();

    public ZoneId resolveZone() {
        return (zoneId == null || zoneId.isBlank()) ? ZoneId.systemDefault() : ZoneId.of(zoneId);
    }

    @Getter
    @Setter
    public static class Defaults {
        private double latitude = 10.8505;
        private double longitude = 76.2711;
        private double radiusMeters = 500;
        private String allowedNetwork = "OfficeWiFi";
        private String startTime = "09:00";
        private String endTime = "17:00";

        public AccessPolicy toPolicy() {
            return AccessPolicy.builder()
                    .latitude(latitude)
                    .longitude(longitude)
                    .radiusMeters(radiusMeters)
                    .allowedNetwork(allowedNetwork)
                    .startTime(startTime)
                    .endTime(endTime)
                    .build();
        }
    }
}
