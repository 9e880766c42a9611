package com.ryuqq.conductor.core.spi;

import com.ryuqq.conductor.core.session.CoordinationSession;

import java.util.List;
import java.util.Optional;

/**
 * Coordination session storage SPI.
 *
 * <p>Sessions are short-lived records keyed by orchestration id. Terminal sessions are
 * retained for inspection until {@link #clear()} is called.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe under concurrent insert, update and read</li>
 *   <li>{@link #save} replaces any session stored under the same orchestration id</li>
 *   <li>{@link #listActive} returns only sessions whose status is ACTIVE at call time</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface SessionStore {

    /**
     * Stores a session under its orchestration id.
     *
     * @param session the session
     * @throws IllegalArgumentException if session is null
     */
    void save(CoordinationSession session);

    /**
     * Stores a session unless an ACTIVE session already exists under the same id.
     *
     * @param session the candidate session
     * @return the ACTIVE session already stored, or the candidate once stored
     * @throws IllegalArgumentException if session is null
     */
    CoordinationSession saveIfAbsentOrTerminal(CoordinationSession session);

    /**
     * Finds a session by orchestration id.
     *
     * @param orchestrationId the orchestration id
     * @return the session, or empty
     */
    Optional<CoordinationSession> find(String orchestrationId);

    /**
     * Lists ACTIVE sessions.
     *
     * @return active sessions, oldest first
     */
    List<CoordinationSession> listActive();

    /**
     * Lists every retained session.
     *
     * @return all sessions, oldest first
     */
    List<CoordinationSession> listAll();

    /**
     * Removes every session (test and administrative reset).
     */
    void clear();
}
