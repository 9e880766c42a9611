/**
 * Scripted executor, risk classifier and approval engine doubles.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.testkit.doubles;
