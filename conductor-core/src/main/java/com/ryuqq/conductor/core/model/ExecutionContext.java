package com.ryuqq.conductor.core.model;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 액션 실행 컨텍스트.
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>tenantId:</strong> 테넌트 식별자 (필수)</li>
 *   <li><strong>userId:</strong> 사용자 식별자 (null 가능)</li>
 *   <li><strong>traceId:</strong> 분산 추적 ID (필수)</li>
 *   <li><strong>sessionId:</strong> 호출자 세션 ID (필수)</li>
 *   <li><strong>orchestrationId:</strong> 다단계 워크플로우 상관 키 (null 가능)</li>
 *   <li><strong>parentDomain:</strong> 호출한 상위 도메인 (null 가능)</li>
 *   <li><strong>permissions:</strong> 명시적 권한 목록 (null = 미지정, 빈 목록과 다름)</li>
 *   <li><strong>roles:</strong> 역할 목록 (null = 미지정)</li>
 * </ul>
 *
 * @param tenantId 테넌트 식별자
 * @param userId 사용자 식별자 (null 가능)
 * @param traceId 추적 ID
 * @param sessionId 세션 ID
 * @param orchestrationId 오케스트레이션 ID (null 가능)
 * @param parentDomain 상위 도메인 (null 가능)
 * @param permissions 권한 목록 (null 가능)
 * @param roles 역할 목록 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ExecutionContext(
    String tenantId,
    String userId,
    String traceId,
    String sessionId,
    String orchestrationId,
    Domain parentDomain,
    List<String> permissions,
    List<String> roles
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException tenantId, traceId, sessionId가 null이거나 빈 문자열인 경우
     */
    public ExecutionContext {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId cannot be null or blank");
        }
        if (traceId == null || traceId.isBlank()) {
            throw new IllegalArgumentException("traceId cannot be null or blank");
        }
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId cannot be null or blank");
        }
        // permissions/roles는 null과 빈 목록을 구분하므로 null은 그대로 유지
        permissions = permissions == null ? null : List.copyOf(permissions);
        roles = roles == null ? null : List.copyOf(roles);
    }

    /**
     * 테넌트만 지정한 최소 컨텍스트 생성 (traceId/sessionId 자동 생성).
     *
     * @param tenantId 테넌트 식별자
     * @return ExecutionContext 인스턴스
     */
    public static ExecutionContext of(String tenantId) {
        return new ExecutionContext(tenantId, null, UUID.randomUUID().toString(),
            UUID.randomUUID().toString(), null, null, null, null);
    }

    /**
     * orchestrationId만 변경한 새 인스턴스 생성.
     */
    public ExecutionContext withOrchestrationId(String orchestrationId) {
        return new ExecutionContext(tenantId, userId, traceId, sessionId, orchestrationId,
            parentDomain, permissions, roles);
    }

    /**
     * userId만 변경한 새 인스턴스 생성.
     */
    public ExecutionContext withUserId(String userId) {
        return new ExecutionContext(tenantId, userId, traceId, sessionId, orchestrationId,
            parentDomain, permissions, roles);
    }

    /**
     * parentDomain만 변경한 새 인스턴스 생성.
     */
    public ExecutionContext withParentDomain(Domain parentDomain) {
        return new ExecutionContext(tenantId, userId, traceId, sessionId, orchestrationId,
            parentDomain, permissions, roles);
    }

    /**
     * permissions만 변경한 새 인스턴스 생성.
     */
    public ExecutionContext withPermissions(List<String> permissions) {
        return new ExecutionContext(tenantId, userId, traceId, sessionId, orchestrationId,
            parentDomain, permissions, roles);
    }

    /**
     * roles만 변경한 새 인스턴스 생성.
     */
    public ExecutionContext withRoles(List<String> roles) {
        return new ExecutionContext(tenantId, userId, traceId, sessionId, orchestrationId,
            parentDomain, permissions, roles);
    }

    /**
     * 오케스트레이션 ID 조회.
     *
     * @return orchestrationId, 없으면 empty
     */
    public Optional<String> findOrchestrationId() {
        return orchestrationId == null || orchestrationId.isBlank()
            ? Optional.empty()
            : Optional.of(orchestrationId);
    }

    /**
     * 역할 보유 여부.
     *
     * @param role 역할 이름
     * @return roles가 지정되어 있고 해당 역할을 포함하면 true
     */
    public boolean hasRole(String role) {
        return roles != null && roles.contains(role);
    }
}
