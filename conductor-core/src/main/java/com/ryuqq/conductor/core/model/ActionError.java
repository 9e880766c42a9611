package com.ryuqq.conductor.core.model;

import java.util.Map;

/**
 * 액션 실패 정보.
 *
 * <p>게이트 거부, 거버넌스 거부, 실행 오류 모두 이 형태로 호출자에게 전달됩니다.
 * 예외는 호출자에게 전파되지 않습니다.</p>
 *
 * @param code 기계 판독용 오류 코드 (예: ORCHESTRA_NOT_FOUND)
 * @param message 사람이 읽을 수 있는 메시지
 * @param details 추가 정보 (빈 맵 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @see ErrorCodes
 */
public record ActionError(
    String code,
    String message,
    Map<String, Object> details
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException code 또는 message가 null이거나 빈 문자열인 경우
     */
    public ActionError {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    /**
     * details 없이 ActionError 생성.
     *
     * @param code 오류 코드
     * @param message 오류 메시지
     * @return ActionError 인스턴스
     */
    public static ActionError of(String code, String message) {
        return new ActionError(code, message, Map.of());
    }
}
