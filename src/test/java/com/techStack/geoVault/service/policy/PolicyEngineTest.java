package com.techStack.geoVault.service.policy;

import com.techStack.geoVault.config.policy.PolicyProperties;
import com.techStack.geoVault.models.policy.AccessPolicy;
import com.techStack.geoVault.models.policy.AccessRequest;
import com.techStack.geoVault.models.policy.PolicyDecision;
import com.techStack.geoVault.models.policy.PolicyOverride;
import com.techStack.geoVault.service.policy.rules.LocationPolicyRule;
import com.techStack.geoVault.service.policy.rules.NetworkPolicyRule;
import com.techStack.geoVault.service.policy.rules.TimeWindowPolicyRule;
import com.techStack.geoVault.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class PolicyEngineTest {

    private static final LocalTime NOON = LocalTime.of(12, 0);

    private MutableClock clock;
    private PolicyProperties properties;
    private PolicyEngine policyEngine;
    private AccessPolicy policy;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-02T06:30:00Z"));
        properties = new PolicyProperties();
        properties.setZoneId("UTC");
        policyEngine = new PolicyEngine(
                List.of(new LocationPolicyRule(), new NetworkPolicyRule(properties), new TimeWindowPolicyRule()),
                clock, properties);
        policy = AccessPolicy.builder()
                .latitude(10.8505)
                .longitude(76.2711)
                .radiusMeters(500)
                .allowedNetwork("OfficeWiFi")
                .startTime("09:00")
                .endTime("17:00")
                .build();
    }

    @Test
    void evaluate_shouldAllow_whenAllRulesPass() {
        AccessRequest request = new AccessRequest(10.8505, 76.2711, "OfficeWiFi");

        PolicyDecision decision = policyEngine.evaluate(request, policy, PolicyOverride.NONE, NOON);

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.reason()).isEqualTo(PolicyEngine.REASON_GRANTED);
        assertThat(decision.validations()).containsOnlyKeys("location", "network", "time");
        assertThat(decision.validations().get("location")).startsWith("Location validated (distance: 0.00m");
        assertThat(decision.wfhGrantId()).isNull();
    }

    @Test
    void evaluate_shouldDenyWithEveryFailure_whenAllRulesFail() {
        AccessRequest request = new AccessRequest(11.8505, 76.2711, "CoffeeShop");

        PolicyDecision decision = policyEngine.evaluate(request, policy, PolicyOverride.NONE, LocalTime.of(20, 0));

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.reason())
                .contains("Outside allowed area")
                .contains("Unauthorized network (CoffeeShop)")
                .contains("Outside allowed hours (current: 20:00, allowed: 09:00-17:00)");
        assertThat(decision.reason().split("; ")).hasSize(3);
    }

    @Test
    void evaluate_shouldDeny_whenLocationAndNetworkMissing() {
        PolicyDecision decision = policyEngine.evaluate(null, policy, PolicyOverride.NONE, NOON);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.validations())
                .containsEntry("location", "Location not provided")
                .containsEntry("network", "Network not provided");
    }

    @Test
    void evaluate_shouldAllowJustInsideRadius_andDenyJustOutside() {
        // ~0.0044 degrees of latitude is roughly 489m
        AccessRequest inside = new AccessRequest(10.8549, 76.2711, "OfficeWiFi");
        AccessRequest outside = new AccessRequest(10.8555, 76.2711, "OfficeWiFi");

        assertThat(policyEngine.evaluate(inside, policy, PolicyOverride.NONE, NOON).allowed()).isTrue();
        assertThat(policyEngine.evaluate(outside, policy, PolicyOverride.NONE, NOON).allowed()).isFalse();
    }

    @Test
    void evaluate_shouldMatchNetworkAsCaseInsensitiveSubstring() {
        AccessRequest request = new AccessRequest(10.8505, 76.2711, "officewifi-5G");

        assertThat(policyEngine.evaluate(request, policy, PolicyOverride.NONE, NOON).allowed()).isTrue();
    }

    @Test
    void evaluate_shouldRequireExactNetwork_whenExactMatchConfigured() {
        properties.setNetworkMatch(PolicyProperties.NetworkMatch.EXACT);
        AccessRequest request = new AccessRequest(10.8505, 76.2711, "OfficeWiFi-5G");

        PolicyDecision decision = policyEngine.evaluate(request, policy, PolicyOverride.NONE, NOON);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.validations().get("network")).isEqualTo("Unauthorized network (OfficeWiFi-5G)");
    }

    @Test
    void evaluate_shouldBypassEveryRule_whenOverrideCoversNow() {
        PolicyOverride override = new PolicyOverride(true,
                clock.instant().minus(Duration.ofHours(1)), clock.instant().plus(Duration.ofHours(1)), "grant-1");

        PolicyDecision decision = policyEngine.evaluate(AccessRequest.EMPTY, policy, override, LocalTime.of(23, 0));

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.reason()).isEqualTo(PolicyEngine.REASON_OVERRIDE);
        assertThat(decision.wfhGrantId()).isEqualTo("grant-1");
        assertThat(decision.validations()).containsValues("bypassed");
    }

    @Test
    void evaluate_shouldIgnoreOverride_whenWindowHasEnded() {
        PolicyOverride override = new PolicyOverride(true,
                clock.instant().minus(Duration.ofHours(2)), clock.instant().minus(Duration.ofSeconds(1)), "grant-1");

        PolicyDecision decision = policyEngine.evaluate(AccessRequest.EMPTY, policy, override, NOON);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.wfhGrantId()).isNull();
    }

    @Test
    void evaluate_shouldFailTimeRule_whenConfiguredWindowIsMalformed() {
        policy.setStartTime("9am");
        AccessRequest request = new AccessRequest(10.8505, 76.2711, "OfficeWiFi");

        PolicyDecision decision = policyEngine.evaluate(request, policy, PolicyOverride.NONE, NOON);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.validations().get("time")).startsWith("Invalid time format in config");
    }

    @Test
    void evaluate_shouldUseClockInConfiguredZone_whenNoTimeGiven() {
        // 06:30 UTC is 12:00 in Asia/Kolkata
        properties.setZoneId("Asia/Kolkata");
        PolicyEngine kolkata = new PolicyEngine(List.of(new TimeWindowPolicyRule()), clock, properties);

        PolicyDecision decision = kolkata.evaluate(AccessRequest.EMPTY, policy, PolicyOverride.NONE);

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.validations().get("time")).isEqualTo("Time validated (12:00)");
    }
}
