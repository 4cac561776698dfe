package com.techStack.geoVault.service.policy.rules;

import com.techStack.geoVault.models.policy.AccessPolicy;
import com.techStack.geoVault.models.policy.AccessRequest;
import com.techStack.geoVault.service.policy.GeoDistance;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.util.Locale;

@Component
@Order(10)
public class LocationPolicyRule implements PolicyRule {

    @Override
    public String name() {
        return "location";
    }

    @Override
    public RuleOutcome evaluate(AccessRequest request, AccessPolicy policy, LocalTime now) {
        if (!request.hasLocation()) {
            return RuleOutcome.fail("Location not provided");
        }

        double distance = GeoDistance.haversineMeters(
                request.latitude(), request.longitude(), policy.getLatitude(), policy.getLongitude());

        if (distance <= policy.getRadiusMeters()) {
            return RuleOutcome.pass(String.format(Locale.ROOT, "Location validated (distance: %.2fm)", distance));
        }
        return RuleOutcome.fail(String.format(Locale.ROOT,
                "Outside allowed area (distance: %.2fm, max: %.0fm)", distance, policy.getRadiusMeters()));
    }
}
