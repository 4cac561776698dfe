package com.techStack.geoVault.service.policy.rules;

import com.techStack.geoVault.config.policy.PolicyProperties;
import com.techStack.geoVault.models.policy.AccessPolicy;
import com.techStack.geoVault.models.policy.AccessRequest;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.LocalTime;

/**
 * Case-insensitive network identifier match. In SUBSTRING mode either value may contain the other,
 * which tolerates SSID suffixes such as "-5G" but also accepts look-alike names.
 */
@Component
@Order(20)
@RequiredArgsConstructor
public class NetworkPolicyRule implements PolicyRule {

    private final PolicyProperties properties;

    @Override
    public String name() {
        return "network";
    }

    @Override
    public RuleOutcome evaluate(AccessRequest request, AccessPolicy policy, LocalTime now) {
        if (!request.hasNetwork()) {
            return RuleOutcome.fail("Network not provided");
        }
        String allowed = StringUtils.trimToEmpty(policy.getAllowedNetwork());
        if (allowed.isEmpty()) {
            return RuleOutcome.fail("No allowed network configured");
        }

        String presented = request.network().trim();
        if (matches(presented, allowed)) {
            return RuleOutcome.pass("Network validated (" + presented + ")");
        }
        return RuleOutcome.fail("Unauthorized network (" + presented + ")");
    }

    private boolean matches(String presented, String allowed) {
        if (properties.getNetworkMatch() == PolicyProperties.NetworkMatch.EXACT) {
            return presented.equalsIgnoreCase(allowed);
        }
        return StringUtils.containsIgnoreCase(presented, allowed)
                || StringUtils.containsIgnoreCase(allowed, presented);
    }
}
