package com.ryuqq.conductor.adapter.inmemory.telemetry;

import com.ryuqq.conductor.core.spi.audit.AuditEntry;
import com.ryuqq.conductor.core.spi.audit.AuditLogger;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory audit trail kept in append order.
 *
 * <p>Reference implementation for tests and local runs. No hash chain.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryAuditLogger implements AuditLogger {

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public void log(AuditEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry cannot be null");
        }
        entries.add(entry);
    }

    /**
     * Snapshot of the trail, oldest first.
     */
    public List<AuditEntry> entries() {
        return List.copyOf(entries);
    }

    /**
     * Entries with the given audit action.
     *
     * @param action e.g. {@code orchestra.action.failed}
     * @return matching entries, oldest first
     */
    public List<AuditEntry> entriesFor(String action) {
        return entries.stream().filter(entry -> entry.action().equals(action)).toList();
    }

    public void clear() {
        entries.clear();
    }
}
