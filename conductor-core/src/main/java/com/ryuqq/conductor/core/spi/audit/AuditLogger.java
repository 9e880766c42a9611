package com.ryuqq.conductor.core.spi.audit;

/**
 * Audit trail SPI.
 *
 * <p>Hash-chaining and persistence of the trail belong to the implementation. The conductor
 * calls {@link #log(AuditEntry)} fire-and-forget: failures are logged and never change the
 * outcome of the audited operation.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AuditLogger {

    /**
     * Appends an entry to the audit trail.
     *
     * @param entry the entry
     */
    void log(AuditEntry entry);

    /**
     * Logger that discards every entry.
     *
     * @return a no-op audit logger
     */
    static AuditLogger noop() {
        return entry -> { };
    }
}
