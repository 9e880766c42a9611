package com.ryuqq.conductor.core.spi.policy;

/**
 * Policy allows the action.
 *
 * @param evaluatedPolicies number of policies evaluated (informational)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PolicyAllow(int evaluatedPolicies) implements PolicyDecision {

    public PolicyAllow {
        if (evaluatedPolicies < 0) {
            throw new IllegalArgumentException("evaluatedPolicies must be non-negative");
        }
    }

    public static PolicyAllow of() {
        return new PolicyAllow(0);
    }
}
