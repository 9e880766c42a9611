package com.ryuqq.conductor.core.session;

/**
 * 세션 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>ACTIVE → COMPLETED</li>
 *   <li>ACTIVE → FAILED</li>
 *   <li>ACTIVE → ABORTED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> 종료 상태는 정확히 한 번만 설정됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SessionTransition {

    private SessionTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(SessionStatus from, SessionStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        // ACTIVE → ACTIVE는 전이가 아님
        if (!to.isTerminal()) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static SessionStatus transition(SessionStatus current, SessionStatus next) {
        validate(current, next);
        return next;
    }
}
