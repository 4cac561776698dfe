package com.techStack.geoVault.service.policy.rules;

import com.techStack.geoVault.models.policy.AccessPolicy;
import com.techStack.geoVault.models.policy.AccessRequest;

import java.time.LocalTime;

/**
 * One independent check of the access policy. Rules never throw for bad input;
 * a missing or malformed value is a failed outcome.
 */
public interface PolicyRule {

    /** Key under which this rule's message appears in the decision's validations. */
    String name();

    RuleOutcome evaluate(AccessRequest request, AccessPolicy policy, LocalTime now);
}
