package com.ryuqq.conductor.core.spi.policy;

/**
 * Policy denies the action.
 *
 * @param code enforcer-defined denial code (e.g. POLICY_DENIED, DATA_RESIDENCY_VIOLATION)
 * @param reason human readable reason
 * @param policyId id of the deciding policy (nullable)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PolicyDenial(
    String code,
    String reason,
    String policyId
) implements PolicyDecision {

    public PolicyDenial {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code cannot be null or blank");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }

    public static PolicyDenial of(String code, String reason) {
        return new PolicyDenial(code, reason, null);
    }
}
