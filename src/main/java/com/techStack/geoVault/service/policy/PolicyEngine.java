package com.techStack.geoVault.service.policy;

import com.techStack.geoVault.config.policy.PolicyProperties;
import com.techStack.geoVault.models.policy.AccessPolicy;
import com.techStack.geoVault.models.policy.AccessRequest;
import com.techStack.geoVault.models.policy.PolicyDecision;
import com.techStack.geoVault.models.policy.PolicyOverride;
import com.techStack.geoVault.service.policy.rules.PolicyRule;
import com.techStack.geoVault.service.policy.rules.RuleOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates an access request against the policy rules. An active override short-circuits every rule;
 * otherwise all rules run and the result is their conjunction.
 */
@Slf4j
@Component
public class PolicyEngine {

    public static final String REASON_GRANTED = "Access granted";
    public static final String REASON_OVERRIDE = "WFH approved - time window active";
    private static final String BYPASSED = "bypassed";

    private final List<PolicyRule> rules;
    private final Clock clock;
    private final ZoneId zone;

    public PolicyEngine(List<PolicyRule> rules, Clock clock, PolicyProperties properties) {
        this.rules = List.copyOf(rules);
        this.clock = clock;
        this.zone = properties.resolveZone();
    }

    /**
     * Evaluates with the current local time in the configured policy zone.
     */
    public PolicyDecision evaluate(AccessRequest request, AccessPolicy policy, PolicyOverride override) {
        return evaluate(request, policy, override, LocalTime.now(clock.withZone(zone)));
    }

    public PolicyDecision evaluate(AccessRequest request, AccessPolicy policy, PolicyOverride override, LocalTime now) {
        AccessRequest effective = AccessRequest.orEmpty(request);

        if (override != null && override.covers(clock.instant())) {
            Map<String, String> bypassed = new LinkedHashMap<>();
            rules.forEach(rule -> bypassed.put(rule.name(), BYPASSED));
            log.debug("Policy bypassed by WFH grant {}", override.grantId());
            return PolicyDecision.allowByGrant(REASON_OVERRIDE, bypassed, override.grantId());
        }

        Map<String, String> validations = new LinkedHashMap<>();
        List<String> failures = new ArrayList<>();
        for (PolicyRule rule : rules) {
            RuleOutcome outcome = rule.evaluate(effective, policy, now);
            validations.put(rule.name(), outcome.message());
            if (!outcome.passed()) {
                failures.add(outcome.message());
            }
        }

        if (failures.isEmpty()) {
            return PolicyDecision.allow(REASON_GRANTED, validations);
        }
        return PolicyDecision.deny(String.join("; ", failures), validations);
    }

    public ZoneId zone() {
        return zone;
    }
}
