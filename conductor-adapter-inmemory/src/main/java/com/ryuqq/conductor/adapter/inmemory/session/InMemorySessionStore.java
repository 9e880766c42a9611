package com.ryuqq.conductor.adapter.inmemory.session;

import com.ryuqq.conductor.core.session.CoordinationSession;
import com.ryuqq.conductor.core.spi.SessionStore;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link SessionStore}.
 *
 * <p>Sessions are stored in a {@link ConcurrentHashMap} keyed by orchestration id. Session
 * objects synchronize their own state transitions; the map only guards identity.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Terminal sessions are retained until {@link #clear()} (no eviction)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemorySessionStore implements SessionStore {

    private static final Comparator<CoordinationSession> OLDEST_FIRST =
        Comparator.comparing(CoordinationSession::getStartedAt);

    private final ConcurrentHashMap<String, CoordinationSession> sessions = new ConcurrentHashMap<>();

    @Override
    public void save(CoordinationSession session) {
        if (session == null) {
            throw new IllegalArgumentException("session cannot be null");
        }
        sessions.put(session.getOrchestrationId(), session);
    }

    /**
     * {@inheritDoc}
     *
     * <p>Atomic per orchestration id via {@link ConcurrentHashMap#compute}.</p>
     */
    @Override
    public CoordinationSession saveIfAbsentOrTerminal(CoordinationSession session) {
        if (session == null) {
            throw new IllegalArgumentException("session cannot be null");
        }
        return sessions.compute(session.getOrchestrationId(),
            (id, existing) -> existing != null && existing.isActive() ? existing : session);
    }

    @Override
    public Optional<CoordinationSession> find(String orchestrationId) {
        if (orchestrationId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(orchestrationId));
    }

    @Override
    public List<CoordinationSession> listActive() {
        return sessions.values().stream()
            .filter(CoordinationSession::isActive)
            .sorted(OLDEST_FIRST)
            .toList();
    }

    @Override
    public List<CoordinationSession> listAll() {
        return sessions.values().stream()
            .sorted(OLDEST_FIRST)
            .toList();
    }

    @Override
    public void clear() {
        sessions.clear();
    }
}
