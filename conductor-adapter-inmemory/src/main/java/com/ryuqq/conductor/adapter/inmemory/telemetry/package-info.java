/**
 * Recording audit logger and event emitter, kept in memory for inspection.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.adapter.inmemory.telemetry;
