package com.ryuqq.conductor.core.telemetry;

/**
 * 커널 메트릭 이름 상수.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MetricNames {

    public static final String MANIFESTS_REGISTERED = "orchestra.manifests.registered";
    public static final String ORCHESTRAS_ACTIVE = "orchestra.orchestras.active";
    public static final String AGENTS_ACTIVE = "orchestra.agents.active";
    public static final String CROSS_AUTH_CHECKS = "orchestra.cross_auth.checks";
    public static final String ACTIONS = "orchestra.actions";
    public static final String ACTION_DURATION = "orchestra.action.duration";
    public static final String ERRORS = "orchestra.errors";
    public static final String COORDINATION_SESSIONS_ACTIVE = "orchestra.coordination.sessions.active";
    public static final String COORDINATION_DURATION = "orchestra.coordination.duration";
    public static final String COORDINATIONS = "orchestra.coordinations";

    private MetricNames() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
