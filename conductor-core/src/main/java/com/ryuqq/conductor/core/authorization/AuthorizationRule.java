package com.ryuqq.conductor.core.authorization;

import com.ryuqq.conductor.core.model.Domain;

import java.util.Set;

/**
 * 도메인별 교차 오케스트라 인가 규칙.
 *
 * <p>방향성이 있는 규칙입니다. canCallDomains(나가는 간선)와 canBeCalledBy(들어오는 간선)는
 * 독립적으로 선언되며 자동으로 대칭화되지 않습니다. 일관성은 규칙 작성자가 책임집니다.</p>
 *
 * @param canCallDomains 이 도메인이 호출할 수 있는 도메인
 * @param canBeCalledBy 이 도메인을 호출할 수 있는 도메인
 * @param restrictedActions 이 도메인이 발신자일 때 금지되는 액션 (빈 집합 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record AuthorizationRule(
    Set<Domain> canCallDomains,
    Set<Domain> canBeCalledBy,
    Set<String> restrictedActions
) {

    public AuthorizationRule {
        canCallDomains = canCallDomains == null ? Set.of() : Set.copyOf(canCallDomains);
        canBeCalledBy = canBeCalledBy == null ? Set.of() : Set.copyOf(canBeCalledBy);
        restrictedActions = restrictedActions == null ? Set.of() : Set.copyOf(restrictedActions);
    }

    /**
     * 제한 액션 없이 규칙 생성.
     */
    public static AuthorizationRule of(Set<Domain> canCallDomains, Set<Domain> canBeCalledBy) {
        return new AuthorizationRule(canCallDomains, canBeCalledBy, Set.of());
    }

    /**
     * 대상 도메인 호출 가능 여부.
     */
    public boolean canCall(Domain target) {
        return canCallDomains.contains(target);
    }

    /**
     * 액션 제한 여부.
     */
    public boolean isRestricted(String action) {
        return restrictedActions.contains(action);
    }
}
