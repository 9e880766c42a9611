package com.ryuqq.conductor.core.model;

/**
 * 컨덕터가 생성하는 안정적인 오류 코드.
 *
 * <p>실행자(DomainExecutor)가 정의한 비즈니스 오류 코드는 변경 없이 그대로 전달됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ErrorCodes {

    // 구조적 오류
    public static final String ORCHESTRA_NOT_FOUND = "ORCHESTRA_NOT_FOUND";
    public static final String ORCHESTRA_DISABLED = "ORCHESTRA_DISABLED";
    public static final String DEPENDENCIES_MISSING = "DEPENDENCIES_MISSING";
    public static final String NOT_IMPLEMENTED = "NOT_IMPLEMENTED";

    // 거버넌스 오류
    public static final String CROSS_ORCHESTRA_DENIED = "CROSS_ORCHESTRA_DENIED";
    public static final String POLICY_DENIED = "POLICY_DENIED";
    public static final String HITL_DENIED = "HITL_DENIED";
    public static final String HITL_FAILED = "HITL_FAILED";

    // 실행 오류
    public static final String EXECUTION_ERROR = "EXECUTION_ERROR";

    private ErrorCodes() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
