package com.ryuqq.conductor.core.spi;

import com.ryuqq.conductor.core.model.ActionRequest;
import com.ryuqq.conductor.core.model.ActionResult;
import com.ryuqq.conductor.core.model.Domain;

/**
 * Domain-specific action handler SPI.
 *
 * <p>One executor serves one {@link Domain}. The conductor treats it as a black box: it
 * hands over an {@link ActionRequest} that already passed every governance gate and
 * receives an {@link ActionResult}.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Expected business failures are returned as a failed result with an executor-defined
 *       error code; they must not be thrown</li>
 *   <li>Unexpected faults may be thrown; the conductor maps them to {@code EXECUTION_ERROR}</li>
 *   <li>Thread-safe: parallel workflows may invoke the same executor concurrently</li>
 *   <li>Timeouts are owned by the executor; the conductor imposes none</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface DomainExecutor {

    /**
     * The domain this executor serves.
     *
     * @return the domain
     */
    Domain domain();

    /**
     * Executes an action.
     *
     * @param request the governed request
     * @return the action result, never null
     */
    ActionResult execute(ActionRequest request);
}
