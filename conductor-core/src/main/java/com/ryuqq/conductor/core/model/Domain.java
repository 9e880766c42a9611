package com.ryuqq.conductor.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * 오케스트라 도메인 구분자.
 *
 * <p>Domain은 고정된 닫힌 집합이며, 레지스트리/인가 테이블/세션 등
 * 모든 곳에서 맵 키로 사용됩니다.</p>
 *
 * <p><strong>와이어 식별자:</strong></p>
 * <ul>
 *   <li>DATABASE - "database"</li>
 *   <li>UX_UI - "ux-ui"</li>
 *   <li>BFF_API - "bff-api"</li>
 *   <li>BACKEND_INFRA - "backend-infra"</li>
 *   <li>COMPLIANCE - "compliance"</li>
 *   <li>OBSERVABILITY - "observability"</li>
 *   <li>FINANCE - "finance"</li>
 *   <li>DEVEX - "devex"</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum Domain {

    DATABASE("database"),
    UX_UI("ux-ui"),
    BFF_API("bff-api"),
    BACKEND_INFRA("backend-infra"),
    COMPLIANCE("compliance"),
    OBSERVABILITY("observability"),
    FINANCE("finance"),
    DEVEX("devex");

    private final String id;

    Domain(String id) {
        this.id = id;
    }

    /**
     * 와이어 식별자 조회.
     *
     * @return 식별자 (예: "ux-ui")
     */
    @JsonValue
    public String getId() {
        return id;
    }

    /**
     * 식별자로 Domain 조회.
     *
     * @param id 와이어 식별자
     * @return Domain
     * @throws IllegalArgumentException 알 수 없는 식별자인 경우
     */
    @JsonCreator
    public static Domain of(String id) {
        return find(id).orElseThrow(
            () -> new IllegalArgumentException("Unknown orchestration domain: " + id));
    }

    /**
     * 식별자로 Domain 조회 (예외 없음).
     *
     * @param id 와이어 식별자 (null 허용)
     * @return 일치하는 Domain, 없으면 empty
     */
    public static Optional<Domain> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        for (Domain domain : values()) {
            if (domain.id.equals(id)) {
                return Optional.of(domain);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return id;
    }
}
