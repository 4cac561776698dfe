package com.techStack.geoVault.service.policy.rules;

public record RuleOutcome(boolean passed, String message) {

    public static RuleOutcome pass(String message) {
        return new RuleOutcome(true, message);
    }

    public static RuleOutcome fail(String message) {
        return new RuleOutcome(false, message);
    }
}
