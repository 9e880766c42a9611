package com.ryuqq.conductor.testkit.fixture;

import com.ryuqq.conductor.core.model.ActionRequest;
import com.ryuqq.conductor.core.model.Arguments;
import com.ryuqq.conductor.core.model.Domain;
import com.ryuqq.conductor.core.model.ExecutionContext;

import java.util.Map;

/**
 * Action request builders for tests.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Requests {

    public static final String TENANT = "tenant-test";
    public static final String USER = "user-test";

    private Requests() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Context for {@link #TENANT} and {@link #USER}, no permissions or roles supplied.
     */
    public static ExecutionContext context() {
        return ExecutionContext.of(TENANT).withUserId(USER);
    }

    public static ActionRequest request(Domain domain, String action) {
        return ActionRequest.of(domain, action, Arguments.empty(), context());
    }

    public static ActionRequest request(Domain domain, String action, Map<String, ?> arguments) {
        return ActionRequest.of(domain, action, Arguments.of(arguments), context());
    }
}
