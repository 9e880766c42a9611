/**
 * Coordination session lifecycle.
 *
 * <h2>State Diagram</h2>
 * <pre>
 * ACTIVE ──→ COMPLETED
 *    │
 *    ├──→ FAILED
 *    │
 *    └──→ ABORTED
 * </pre>
 *
 * <p>Terminal states are final. {@link com.ryuqq.conductor.core.session.SessionTransition}
 * rejects every other move with {@link IllegalStateException}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.core.session;
