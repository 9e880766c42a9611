package com.ryuqq.conductor.application.registry;

import java.util.List;

/**
 * 매니페스트 등록 결과.
 *
 * @param success 등록 성공 여부
 * @param manifestHash 콘텐츠 해시 (실패 시 null)
 * @param errors 검증 오류 목록 (성공 시 빈 목록)
 * @param error 오류 요약 (성공 시 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RegistrationResult(
    boolean success,
    String manifestHash,
    List<String> errors,
    String error
) {

    public RegistrationResult {
        if (success && (manifestHash == null || manifestHash.isBlank())) {
            throw new IllegalArgumentException("manifestHash is required for a successful registration");
        }
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static RegistrationResult registered(String manifestHash) {
        return new RegistrationResult(true, manifestHash, List.of(), null);
    }

    /**
     * 검증 실패 결과 생성.
     *
     * @param errors 검증 오류 목록
     * @return 실패 결과 ("Manifest validation failed: " 요약 포함)
     */
    public static RegistrationResult rejected(List<String> errors) {
        return new RegistrationResult(false, null, errors,
            "Manifest validation failed: " + String.join("; ", errors));
    }
}
