package com.ryuqq.conductor.core.spi.policy;

/**
 * Outcome of a policy evaluation.
 *
 * <p>Sealed so that callers handle both cases explicitly:</p>
 * <ul>
 *   <li>{@link PolicyAllow}: the action may proceed</li>
 *   <li>{@link PolicyDenial}: the action stops before dispatch with the enforcer's code</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface PolicyDecision permits PolicyAllow, PolicyDenial {

    /**
     * Whether the action may proceed.
     *
     * @return true for {@link PolicyAllow}
     */
    default boolean isAllowed() {
        return this instanceof PolicyAllow;
    }
}
