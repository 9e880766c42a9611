package com.ryuqq.conductor.core.manifest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 정책 우선순위 등급.
 *
 * <p>LEGAL &gt; INDUSTRY &gt; INTERNAL 순으로 우선합니다.
 * 실제 우선순위 해석은 외부 정책 엔진이 담당합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum PolicyPrecedence {

    LEGAL("legal"),
    INDUSTRY("industry"),
    INTERNAL("internal");

    private final String value;

    PolicyPrecedence(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * 문자열로 PolicyPrecedence 조회.
     *
     * @param value "legal", "industry", "internal"
     * @return PolicyPrecedence
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    @JsonCreator
    public static PolicyPrecedence of(String value) {
        for (PolicyPrecedence precedence : values()) {
            if (precedence.value.equals(value)) {
                return precedence;
            }
        }
        throw new IllegalArgumentException("Unknown policy precedence: " + value);
    }
}
