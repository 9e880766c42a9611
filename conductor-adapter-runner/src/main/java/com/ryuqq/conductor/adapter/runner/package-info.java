/**
 * Runner Adapter Layer - Conductor 구현체.
 *
 * <p>이 패키지는 Conductor 인터페이스의 구체적인 구현체와 이를 둘러싼 기본 어댑터를 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.adapter.runner.OrchestraConductor} - 게이트 순서대로 액션을 라우팅하는 컨덕터</li>
 *   <li>{@link com.ryuqq.conductor.adapter.runner.RuleTableAuthorizer} - 규칙 테이블 기반 교차 도메인 인가</li>
 *   <li>{@link com.ryuqq.conductor.adapter.runner.MicrometerMetricsSink} - Micrometer 메트릭 싱크</li>
 *   <li>{@link com.ryuqq.conductor.adapter.runner.LoggingAuditLogger} - SLF4J 감사 로거</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (OrchestraConductor)
 *   ↓ implements
 * application (Conductor, CrossOrchestraAuthorizer, ManifestRegistry)
 *   ↓ depends on
 * core (ActionRequest, ActionResult, CoordinationSession, SideChannel)
 *   ↓ depends on
 * core/spi (DomainExecutor, SessionStore, PolicyEnforcer, ApprovalEngine)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.conductor.adapter.runner;
