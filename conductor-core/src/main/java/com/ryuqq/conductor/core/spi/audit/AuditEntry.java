package com.ryuqq.conductor.core.spi.audit;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Audit trail entry handed to the {@link AuditLogger}.
 *
 * @param tenantId tenant the entry belongs to (null for registry operations)
 * @param subject acting principal (user id or "system")
 * @param action audit action, e.g. {@code orchestra.action.completed}
 * @param resource affected resource, e.g. {@code orchestra://finance/generate_invoice}
 * @param category audit category, {@code kernel} by default
 * @param severity severity
 * @param details free-form details, insertion ordered
 * @param timestamp when the audited event happened
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record AuditEntry(
    String tenantId,
    String subject,
    String action,
    String resource,
    String category,
    AuditSeverity severity,
    Map<String, Object> details,
    Instant timestamp
) {

    public static final String CATEGORY = "kernel";

    public AuditEntry {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject cannot be null or blank");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action cannot be null or blank");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        category = category == null ? CATEGORY : category;
        // Map.copyOf would drop insertion order and reject null values
        details = details == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }
}
