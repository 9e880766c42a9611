package com.ryuqq.conductor.core.manifest;

/**
 * 오케스트라 정책 선언.
 *
 * @param id 정책 ID
 * @param domain 정책이 속한 도메인 식별자
 * @param rule 규칙 텍스트 (해석은 외부 정책 엔진 담당)
 * @param precedence 우선순위 등급
 * @param enforced 강제 여부
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PolicyDefinition(
    String id,
    String domain,
    String rule,
    PolicyPrecedence precedence,
    boolean enforced
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id가 null이거나 precedence가 null인 경우
     */
    public PolicyDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("policy id cannot be null or blank");
        }
        if (precedence == null) {
            throw new IllegalArgumentException("precedence cannot be null");
        }
    }
}
