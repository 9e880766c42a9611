/**
 * Error-isolating side channel for audit entries, events and metrics.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.core.telemetry;
