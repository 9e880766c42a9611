/**
 * Static cross-orchestra authorization graph.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.core.authorization;
