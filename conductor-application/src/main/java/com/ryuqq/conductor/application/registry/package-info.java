/**
 * 매니페스트 레지스트리 포트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.conductor.application.registry;
