package com.ryuqq.conductor.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * 오케스트라 액션 결과.
 *
 * <p>성공 시 data(선택)를, 실패 시 error(필수)를 담습니다.
 * metadata.executionTimeMs는 빠른 거부에서도 항상 존재합니다.</p>
 *
 * <p><strong>Pattern 예시:</strong></p>
 * <pre>
 * ActionResult result = conductor.coordinateAction(request);
 * if (!result.success()) {
 *     log.warn("{} rejected: {}", result.actionType(), result.error().code());
 * }
 * </pre>
 *
 * @param success 성공 여부
 * @param domain 요청 도메인 (echo)
 * @param action 요청 액션 (echo)
 * @param data 결과 데이터 (null 가능)
 * @param error 실패 정보 (성공 시 null)
 * @param metadata 실행 메타데이터
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ActionResult(
    boolean success,
    Domain domain,
    String action,
    JsonNode data,
    ActionError error,
    ActionMetadata metadata
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 실패인데 error가 없는 경우
     */
    public ActionResult {
        if (domain == null) {
            throw new IllegalArgumentException("domain cannot be null");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action cannot be null or blank");
        }
        if (!success && error == null) {
            throw new IllegalArgumentException("error is required for a failed result");
        }
        metadata = metadata == null ? ActionMetadata.timed(0) : metadata;
    }

    /**
     * 성공 결과 생성.
     *
     * @param domain 도메인
     * @param action 액션
     * @param data 결과 데이터 (null 가능)
     * @param metadata 메타데이터
     * @return 성공 ActionResult
     */
    public static ActionResult ok(Domain domain, String action, JsonNode data, ActionMetadata metadata) {
        return new ActionResult(true, domain, action, data, null, metadata);
    }

    /**
     * 실패 결과 생성.
     *
     * @param domain 도메인
     * @param action 액션
     * @param error 실패 정보
     * @param metadata 메타데이터
     * @return 실패 ActionResult
     */
    public static ActionResult failed(Domain domain, String action, ActionError error, ActionMetadata metadata) {
        return new ActionResult(false, domain, action, null, error, metadata);
    }

    /**
     * 요청 기준 실패 결과 생성.
     *
     * @param request 원 요청
     * @param code 오류 코드
     * @param message 오류 메시지
     * @param executionTimeMs 실행 시간
     * @return 실패 ActionResult
     */
    public static ActionResult failed(ActionRequest request, String code, String message, long executionTimeMs) {
        return failed(request.domain(), request.action(), ActionError.of(code, message),
            ActionMetadata.timed(executionTimeMs));
    }

    /**
     * executionTimeMs만 변경한 새 인스턴스 생성.
     */
    public ActionResult withExecutionTimeMs(long executionTimeMs) {
        return new ActionResult(success, domain, action, data, error, metadata.withExecutionTimeMs(executionTimeMs));
    }

    /**
     * 오류 코드 조회.
     *
     * @return 실패 시 오류 코드, 성공 시 empty
     */
    public Optional<String> errorCode() {
        return error == null ? Optional.empty() : Optional.of(error.code());
    }

    /**
     * "domain.action" 형태의 액션 타입.
     */
    public String actionType() {
        return domain.getId() + "." + action;
    }
}
