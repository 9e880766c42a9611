package com.ryuqq.conductor.application.conductor;

import com.ryuqq.conductor.core.model.ActionRequest;
import com.ryuqq.conductor.core.model.ActionResult;
import com.ryuqq.conductor.core.session.CoordinationSession;

import java.util.List;
import java.util.Optional;

/**
 * 오케스트라 액션 조정자.
 *
 * <p>액션 요청을 도메인 오케스트라로 라우팅하며, 디스패치 전에 거버넌스 게이트를 순서대로 적용합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ActionResult result = conductor.coordinateAction(
 *     ActionRequest.of(Domain.FINANCE, "generate_invoice", args, context));
 *
 * if (!result.success()) {
 *     // result.error().code(): ORCHESTRA_DISABLED, HITL_DENIED, ...
 * }
 *
 * List&lt;ActionResult&gt; results = conductor.coordinateCrossOrchestra(steps, false);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Conductor {

    /**
     * 단일 액션 조정.
     *
     * <p><strong>게이트 순서:</strong></p>
     * <ol>
     *   <li>존재 여부 → ORCHESTRA_NOT_FOUND</li>
     *   <li>활성 여부 → ORCHESTRA_DISABLED</li>
     *   <li>의존성 → DEPENDENCIES_MISSING</li>
     *   <li>상위 도메인 교차 인가 → CROSS_ORCHESTRA_DENIED</li>
     *   <li>정책 → 정책 엔진의 거부 코드</li>
     *   <li>위험도/승인 → HITL_DENIED, HITL_FAILED</li>
     *   <li>디스패치 → NOT_IMPLEMENTED, EXECUTION_ERROR, 실행기 코드</li>
     * </ol>
     *
     * <p>이 메서드는 예외를 던지지 않습니다. 모든 실패는 실패 결과로 반환되며,
     * 반환되는 결과의 metadata.executionTimeMs는 진입부터 반환까지의 시간입니다.</p>
     *
     * @param request 액션 요청
     * @return 액션 결과 (never null)
     */
    ActionResult coordinateAction(ActionRequest request);

    /**
     * 교차 도메인 워크플로우 조정.
     *
     * <p>모든 단계에 새 orchestrationId가 부여됩니다(호출자 값은 덮어씀).</p>
     * <ul>
     *   <li><strong>parallel=true:</strong> 모든 단계를 동시에 실행, 입력 순서대로 결과 반환, 단락 없음</li>
     *   <li><strong>parallel=false:</strong> 입력 순서대로 실행, 첫 실패 직후 중단</li>
     * </ul>
     * <p>보상(compensation)은 수행하지 않습니다.</p>
     *
     * @param requests 단계 목록 (빈 목록이면 빈 결과)
     * @param parallel 병렬 실행 여부
     * @return 단계별 결과 (순차 실행에서 실패 시 실패 단계까지만 포함)
     */
    List<ActionResult> coordinateCrossOrchestra(List<ActionRequest> requests, boolean parallel);

    /**
     * 세션 조회.
     *
     * @param orchestrationId 오케스트레이션 ID
     * @return 세션 (없으면 empty)
     */
    Optional<CoordinationSession> getSession(String orchestrationId);

    /**
     * ACTIVE 세션 목록.
     */
    List<CoordinationSession> listActiveSessions();

    /**
     * 모든 세션 제거 (테스트/관리 용도).
     */
    void clearSessions();

    /**
     * 운영자에 의한 세션 중단 (ACTIVE → ABORTED).
     *
     * @param orchestrationId 오케스트레이션 ID
     * @param reason 중단 사유
     * @return 중단되었으면 true, 세션이 없거나 이미 종료되었으면 false
     */
    boolean abortSession(String orchestrationId, String reason);
}
