package com.ryuqq.conductor.core.manifest;

import java.util.Locale;

/**
 * 레지스트리 엔트리 상태.
 *
 * <pre>
 * ACTIVE ──disable──► DISABLED ──enable──► ACTIVE
 * ERROR  (등록 후 오류가 기록된 엔트리)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ManifestStatus {

    /**
     * 활성 (액션 수신 가능).
     */
    ACTIVE,

    /**
     * 비활성 (운영자가 중지).
     */
    DISABLED,

    /**
     * 오류.
     */
    ERROR;

    /**
     * 와이어 표기 (소문자).
     *
     * @return "active", "disabled", "error"
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
