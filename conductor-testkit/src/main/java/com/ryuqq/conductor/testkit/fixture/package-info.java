/**
 * Manifest and request fixtures.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.testkit.fixture;
