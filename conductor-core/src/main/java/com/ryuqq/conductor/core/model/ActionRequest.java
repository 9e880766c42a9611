package com.ryuqq.conductor.core.model;

/**
 * 오케스트라 액션 요청.
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * ActionRequest request = ActionRequest.of(
 *     Domain.DATABASE,
 *     "analyze_schema",
 *     Arguments.of(Map.of("table", "invoices")),
 *     ExecutionContext.of("tenant-1")
 * );
 * </pre>
 *
 * @param domain 대상 도메인
 * @param action 액션 이름
 * @param arguments 액션 인자 (null이면 빈 Arguments)
 * @param context 실행 컨텍스트
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ActionRequest(
    Domain domain,
    String action,
    Arguments arguments,
    ExecutionContext context
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 action이 빈 문자열인 경우
     */
    public ActionRequest {
        if (domain == null) {
            throw new IllegalArgumentException("domain cannot be null");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action cannot be null or blank");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        arguments = arguments == null ? Arguments.empty() : arguments;
    }

    /**
     * ActionRequest 생성.
     *
     * @param domain 대상 도메인
     * @param action 액션 이름
     * @param arguments 액션 인자
     * @param context 실행 컨텍스트
     * @return ActionRequest 인스턴스
     */
    public static ActionRequest of(Domain domain, String action, Arguments arguments, ExecutionContext context) {
        return new ActionRequest(domain, action, arguments, context);
    }

    /**
     * context만 변경한 새 인스턴스 생성.
     */
    public ActionRequest withContext(ExecutionContext context) {
        return new ActionRequest(domain, action, arguments, context);
    }

    /**
     * "domain.action" 형태의 액션 타입.
     *
     * @return 액션 타입 (예: "finance.generate_invoice")
     */
    public String actionType() {
        return domain.getId() + "." + action;
    }
}
