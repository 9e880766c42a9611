/**
 * Conductor Application Layer - 오케스트라 액션 조정 API.
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.application.conductor.Conductor} - 단일 액션 및 교차 도메인 워크플로우 조정자</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-runner 모듈에 위치</li>
 *   <li><strong>명시적 주입:</strong> 정적 싱글톤 없이 생성자로 협력자를 주입</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.conductor.application.conductor;
