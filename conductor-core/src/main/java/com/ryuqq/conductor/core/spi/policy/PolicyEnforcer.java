package com.ryuqq.conductor.core.spi.policy;

/**
 * Policy enforcement SPI.
 *
 * <p>The precedence-resolution engine behind this interface is an external collaborator.
 * The conductor treats a thrown exception the same way as a {@link PolicyDenial}: the
 * action stops before dispatch.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface PolicyEnforcer {

    /**
     * Evaluates the policies that apply to an action.
     *
     * @param request the policy request
     * @return allow or a structured denial, never null
     */
    PolicyDecision evaluate(PolicyRequest request);

    /**
     * Enforcer that allows every action.
     *
     * @return a permissive enforcer
     */
    static PolicyEnforcer permitAll() {
        return request -> PolicyAllow.of();
    }
}
