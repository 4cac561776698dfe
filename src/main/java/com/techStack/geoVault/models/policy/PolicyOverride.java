package com.techStack.geoVault.models.policy;

import java.time.Instant;

/**
 * An approved WFH window that bypasses the location, network and time checks
 * while {@code windowStart <= now <= windowEnd}.
 */
public record PolicyOverride(boolean active, Instant windowStart, Instant windowEnd, String grantId) {

    public static final PolicyOverride NONE = new PolicyOverride(false, null, null, null);

    public boolean covers(Instant now) {
        return active
                && windowStart != null
                && windowEnd != null
                && !now.isBefore(windowStart)
                && !now.isAfter(windowEnd);
    }
}
