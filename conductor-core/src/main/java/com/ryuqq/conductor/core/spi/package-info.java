/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Interfaces implemented outside the kernel. The conductor only depends on these contracts.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.core.spi.DomainExecutor} - Per-domain business logic</li>
 *   <li>{@link com.ryuqq.conductor.core.spi.SessionStore} - Coordination session storage</li>
 *   <li>{@link com.ryuqq.conductor.core.spi.policy.PolicyEnforcer} - Policy precedence engine</li>
 *   <li>{@link com.ryuqq.conductor.core.spi.approval.RiskClassifier} and
 *       {@link com.ryuqq.conductor.core.spi.approval.ApprovalEngine} - Human-in-the-loop gate</li>
 *   <li>{@link com.ryuqq.conductor.core.spi.audit.AuditLogger},
 *       {@link com.ryuqq.conductor.core.spi.event.EventEmitter},
 *       {@link com.ryuqq.conductor.core.spi.metrics.MetricsSink} - Side channels</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., conductor-adapter-inmemory, conductor-adapter-runner) provide
 * implementations; production deployments plug in their own.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.core.spi;
