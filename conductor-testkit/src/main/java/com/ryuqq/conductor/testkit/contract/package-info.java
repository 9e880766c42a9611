/**
 * Abstract contract tests for SessionStore and ManifestRegistry implementations.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.testkit.contract;
