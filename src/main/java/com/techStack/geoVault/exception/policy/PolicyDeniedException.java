package com.techStack.geoVault.exception.policy;

import com.techStack.geoVault.exception.service.CustomException;
import com.techStack.geoVault.models.policy.PolicyDecision;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Carries the full decision so the per-check reasons can be returned to the requester.
 */
@Getter
public class PolicyDeniedException extends CustomException {
    private final PolicyDecision decision;

    public PolicyDeniedException(PolicyDecision decision) {
        super(HttpStatus.FORBIDDEN, decision.reason(), null, "ACCESS_DENIED");
        this.decision = decision;
    }
}
