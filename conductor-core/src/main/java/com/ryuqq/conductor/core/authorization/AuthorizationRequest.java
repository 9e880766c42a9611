package com.ryuqq.conductor.core.authorization;

import com.ryuqq.conductor.core.model.Domain;
import com.ryuqq.conductor.core.model.ExecutionContext;

/**
 * 교차 오케스트라 인가 요청.
 *
 * @param sourceDomain 호출하는 도메인
 * @param targetDomain 호출되는 도메인
 * @param action 요청 액션
 * @param context 실행 컨텍스트
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record AuthorizationRequest(
    Domain sourceDomain,
    Domain targetDomain,
    String action,
    ExecutionContext context
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public AuthorizationRequest {
        if (sourceDomain == null) {
            throw new IllegalArgumentException("sourceDomain cannot be null");
        }
        if (targetDomain == null) {
            throw new IllegalArgumentException("targetDomain cannot be null");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action cannot be null or blank");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
    }

    /**
     * 요구 권한 문자열 ("orchestra.&lt;target&gt;.&lt;action&gt;").
     */
    public String requiredPermission() {
        return "orchestra." + targetDomain.getId() + "." + action;
    }
}
