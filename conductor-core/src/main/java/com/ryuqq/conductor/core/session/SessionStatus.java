package com.ryuqq.conductor.core.session;

import java.util.Locale;

/**
 * 코디네이션 세션의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>ACTIVE → COMPLETED (성공)</li>
 *   <li>ACTIVE → FAILED (실패)</li>
 *   <li>ACTIVE → ABORTED (운영자 취소)</li>
 *   <li><strong>종료 상태에서의 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <pre>
 * ACTIVE
 *    │
 *    ├─► COMPLETED
 *    ├─► FAILED
 *    └─► ABORTED
 *
 * 금지된 전이:
 * - COMPLETED → * ❌
 * - FAILED → * ❌
 * - ABORTED → * ❌
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum SessionStatus {

    /**
     * 진행 중.
     */
    ACTIVE,

    /**
     * 완료 (성공).
     */
    COMPLETED,

    /**
     * 실패.
     */
    FAILED,

    /**
     * 운영자에 의해 취소됨.
     */
    ABORTED;

    /**
     * 종료 상태인지 확인.
     *
     * @return ACTIVE가 아니면 true
     */
    public boolean isTerminal() {
        return this != ACTIVE;
    }

    /**
     * 와이어 표기 (소문자).
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
