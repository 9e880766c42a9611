package com.ryuqq.conductor.core.spi.audit;

/**
 * Severity of an audit entry.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum AuditSeverity {
    INFO,
    WARN,
    ERROR
}
