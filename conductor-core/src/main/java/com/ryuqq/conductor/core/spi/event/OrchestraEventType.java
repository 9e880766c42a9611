package com.ryuqq.conductor.core.spi.event;

/**
 * Kernel event types.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum OrchestraEventType {
    MANIFEST_REGISTERED("orchestra.manifest.registered"),
    MANIFEST_DISABLED("orchestra.manifest.disabled"),
    ACTION_COMPLETED("orchestra.action.completed"),
    ACTION_FAILED("orchestra.action.failed"),
    COORDINATION_STARTED("orchestra.coordination.started"),
    COORDINATION_COMPLETED("orchestra.coordination.completed"),
    COORDINATION_ABORTED("orchestra.coordination.aborted"),
    CROSS_AUTH_CHECKED("orchestra.cross_auth.checked");

    private final String value;

    OrchestraEventType(String value) {
        this.value = value;
    }

    /**
     * Wire name of the event type.
     */
    public String getValue() {
        return value;
    }
}
