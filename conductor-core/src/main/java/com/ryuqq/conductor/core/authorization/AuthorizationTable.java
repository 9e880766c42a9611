package com.ryuqq.conductor.core.authorization;

import com.ryuqq.conductor.core.model.Domain;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 정적 교차 오케스트라 인가 테이블.
 *
 * <p>바이너리에 컴파일되는 정적 테이블이며 영속화되지 않습니다.
 * 기본 테이블({@link #defaults()})은 다음 그래프를 선언합니다:</p>
 * <pre>
 * database       : 리프 (호출 불가)              ← bff-api, backend-infra, compliance
 * ux-ui          : → bff-api                     ← bff-api
 * bff-api        : → database, backend-infra, ux-ui ← ux-ui
 * backend-infra  : → database, observability     ← bff-api, compliance
 * compliance     : → database, backend-infra, observability (피호출 불가)
 * observability  : 리프                          ← backend-infra, compliance, devex
 * finance        : → database, compliance        ← compliance  (create/update/delete 제한)
 * devex          : → observability, backend-infra (피호출 불가)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AuthorizationTable {

    private static final AuthorizationTable DEFAULTS = builder()
        .rule(Domain.DATABASE, AuthorizationRule.of(
            Set.of(),
            Set.of(Domain.BFF_API, Domain.BACKEND_INFRA, Domain.COMPLIANCE)))
        .rule(Domain.UX_UI, AuthorizationRule.of(
            Set.of(Domain.BFF_API),
            Set.of(Domain.BFF_API)))
        .rule(Domain.BFF_API, AuthorizationRule.of(
            Set.of(Domain.DATABASE, Domain.BACKEND_INFRA, Domain.UX_UI),
            Set.of(Domain.UX_UI)))
        .rule(Domain.BACKEND_INFRA, AuthorizationRule.of(
            Set.of(Domain.DATABASE, Domain.OBSERVABILITY),
            Set.of(Domain.BFF_API, Domain.COMPLIANCE)))
        .rule(Domain.COMPLIANCE, AuthorizationRule.of(
            Set.of(Domain.DATABASE, Domain.BACKEND_INFRA, Domain.OBSERVABILITY),
            Set.of()))
        .rule(Domain.OBSERVABILITY, AuthorizationRule.of(
            Set.of(),
            Set.of(Domain.BACKEND_INFRA, Domain.COMPLIANCE, Domain.DEVEX)))
        .rule(Domain.FINANCE, new AuthorizationRule(
            Set.of(Domain.DATABASE, Domain.COMPLIANCE),
            Set.of(Domain.COMPLIANCE),
            Set.of("create", "update", "delete")))
        .rule(Domain.DEVEX, AuthorizationRule.of(
            Set.of(Domain.OBSERVABILITY, Domain.BACKEND_INFRA),
            Set.of()))
        .build();

    private final Map<Domain, AuthorizationRule> rules;

    private AuthorizationTable(Map<Domain, AuthorizationRule> rules) {
        this.rules = rules;
    }

    /**
     * 커널 기본 테이블.
     *
     * @return 기본 AuthorizationTable
     */
    public static AuthorizationTable defaults() {
        return DEFAULTS;
    }

    /**
     * 사용자 정의 테이블 빌더.
     *
     * @return 빈 Builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * 도메인 규칙 조회.
     *
     * @param domain 도메인
     * @return 규칙, 선언되지 않았으면 empty
     */
    public Optional<AuthorizationRule> ruleFor(Domain domain) {
        return Optional.ofNullable(rules.get(domain));
    }

    /**
     * target의 canBeCalledBy에 source가 포함되는지 확인.
     */
    public boolean canBeCalled(Domain target, Domain source) {
        AuthorizationRule rule = rules.get(target);
        return rule != null && rule.canBeCalledBy().contains(source);
    }

    /**
     * source가 호출할 수 있는 도메인 목록 (선언 순서 무관, enum 순서 정렬).
     */
    public List<Domain> allowedTargets(Domain source) {
        AuthorizationRule rule = rules.get(source);
        return rule == null ? List.of() : sorted(rule.canCallDomains());
    }

    /**
     * target을 호출할 수 있는 도메인 목록 (enum 순서 정렬).
     */
    public List<Domain> allowedCallers(Domain target) {
        AuthorizationRule rule = rules.get(target);
        return rule == null ? List.of() : sorted(rule.canBeCalledBy());
    }

    private static List<Domain> sorted(Set<Domain> domains) {
        return domains.stream().sorted().toList();
    }

    /**
     * AuthorizationTable 빌더.
     */
    public static final class Builder {

        private final Map<Domain, AuthorizationRule> rules = new EnumMap<>(Domain.class);

        private Builder() {
        }

        /**
         * 도메인 규칙 등록 (같은 도메인은 덮어씀).
         *
         * @throws IllegalArgumentException domain 또는 rule이 null인 경우
         */
        public Builder rule(Domain domain, AuthorizationRule rule) {
            if (domain == null) {
                throw new IllegalArgumentException("domain cannot be null");
            }
            if (rule == null) {
                throw new IllegalArgumentException("rule cannot be null");
            }
            rules.put(domain, rule);
            return this;
        }

        public AuthorizationTable build() {
            return new AuthorizationTable(Map.copyOf(rules));
        }
    }
}
