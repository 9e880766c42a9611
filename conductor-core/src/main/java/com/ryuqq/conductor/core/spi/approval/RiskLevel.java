package com.ryuqq.conductor.core.spi.approval;

/**
 * Risk level assigned to an action type by the risk classifier.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
