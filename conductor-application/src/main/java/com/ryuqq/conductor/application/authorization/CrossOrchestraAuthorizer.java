package com.ryuqq.conductor.application.authorization;

import com.ryuqq.conductor.core.authorization.AuthorizationRequest;
import com.ryuqq.conductor.core.authorization.AuthorizationResult;
import com.ryuqq.conductor.core.model.Domain;

import java.util.List;

/**
 * 교차 오케스트라 인가기.
 *
 * <p>인가 결정은 허용/거부와 관계없이 모두 감사, 이벤트, 메트릭으로 기록됩니다.
 * 조회 메서드({@link #canBeCalled}, {@link #getAllowedTargets}, {@link #getAllowedCallers})는
 * 정적 테이블만 읽으며 부수 효과가 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CrossOrchestraAuthorizer {

    /**
     * source → target 호출 인가.
     *
     * <p><strong>검사 순서 (첫 실패에서 중단):</strong></p>
     * <ol>
     *   <li>source 활성</li>
     *   <li>target 활성</li>
     *   <li>source 규칙 존재</li>
     *   <li>target이 source의 canCallDomains에 포함</li>
     *   <li>action이 source의 restrictedActions에 미포함</li>
     *   <li>컨텍스트 권한 (admin 역할은 통과)</li>
     * </ol>
     *
     * @param request 인가 요청
     * @return 인가 결과
     */
    AuthorizationResult authorize(AuthorizationRequest request);

    /**
     * target의 canBeCalledBy에 source가 포함되는지 확인.
     */
    boolean canBeCalled(Domain target, Domain source);

    /**
     * source가 호출할 수 있는 도메인 목록.
     */
    List<Domain> getAllowedTargets(Domain source);

    /**
     * target을 호출할 수 있는 도메인 목록.
     */
    List<Domain> getAllowedCallers(Domain target);
}
