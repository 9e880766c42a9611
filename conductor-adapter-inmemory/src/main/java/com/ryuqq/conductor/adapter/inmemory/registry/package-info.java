/**
 * In-memory manifest registry adapter.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.adapter.inmemory.registry;
