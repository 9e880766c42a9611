/**
 * Core request/result model of the conductor kernel.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.core.model.Domain} - Closed set of orchestration domains</li>
 *   <li>{@link com.ryuqq.conductor.core.model.Arguments} - Typed JSON-tree action arguments</li>
 *   <li>{@link com.ryuqq.conductor.core.model.ExecutionContext} - Tenant, user, trace and orchestration identity</li>
 *   <li>{@link com.ryuqq.conductor.core.model.ActionRequest} - Action addressed to one domain</li>
 *   <li>{@link com.ryuqq.conductor.core.model.ActionResult} - Outcome with error and timing metadata</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Records with defensive copies</li>
 *   <li><strong>Validation:</strong> Compact constructors reject null or blank required fields</li>
 *   <li><strong>Stable error codes:</strong> See {@link com.ryuqq.conductor.core.model.ErrorCodes}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.core.model;
