package com.ryuqq.conductor.core.spi.policy;

import com.ryuqq.conductor.core.model.ActionRequest;
import com.ryuqq.conductor.core.model.Arguments;
import com.ryuqq.conductor.core.model.Domain;
import com.ryuqq.conductor.core.model.ExecutionContext;

/**
 * Input handed to the policy enforcer before an action is dispatched.
 *
 * @param domain target domain
 * @param action action name
 * @param arguments action arguments
 * @param context execution context
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PolicyRequest(
    Domain domain,
    String action,
    Arguments arguments,
    ExecutionContext context
) {

    public PolicyRequest {
        if (domain == null) {
            throw new IllegalArgumentException("domain cannot be null");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action cannot be null or blank");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        arguments = arguments == null ? Arguments.empty() : arguments;
    }

    /**
     * Builds a policy request from an action request.
     *
     * @param request the action request
     * @return the policy request
     */
    public static PolicyRequest from(ActionRequest request) {
        return new PolicyRequest(request.domain(), request.action(), request.arguments(), request.context());
    }
}
