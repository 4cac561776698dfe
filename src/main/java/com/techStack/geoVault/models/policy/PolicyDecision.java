package com.techStack.geoVault.models.policy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a policy evaluation. {@code validations} maps each check name to its
 * human-readable result, in evaluation order.
 */
public record PolicyDecision(boolean allowed, String reason, Map<String, String> validations, String wfhGrantId) {

    public PolicyDecision {
        validations = validations == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(validations));
    }

    public static PolicyDecision allow(String reason, Map<String, String> validations) {
        return new PolicyDecision(true, reason, validations, null);
    }

    public static PolicyDecision allowByGrant(String reason, Map<String, String> validations, String grantId) {
        return new PolicyDecision(true, reason, validations, grantId);
    }

    public static PolicyDecision deny(String reason, Map<String, String> validations) {
        return new PolicyDecision(false, reason, validations, null);
    }
}
