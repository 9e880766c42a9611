/**
 * In-memory coordination session store.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.adapter.inmemory.session;
