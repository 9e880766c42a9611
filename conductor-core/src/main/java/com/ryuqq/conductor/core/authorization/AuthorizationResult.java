package com.ryuqq.conductor.core.authorization;

import java.util.List;

/**
 * 교차 오케스트라 인가 결과.
 *
 * @param allowed 허용 여부
 * @param reason 거부 사유 (허용 시 null)
 * @param requiredPermissions 누락된 권한 (권한 검사에서 거부된 경우에만 비어있지 않음)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record AuthorizationResult(
    boolean allowed,
    String reason,
    List<String> requiredPermissions
) {

    private static final AuthorizationResult ALLOWED = new AuthorizationResult(true, null, List.of());

    public AuthorizationResult {
        if (!allowed && (reason == null || reason.isBlank())) {
            throw new IllegalArgumentException("reason is required for a denial");
        }
        requiredPermissions = requiredPermissions == null ? List.of() : List.copyOf(requiredPermissions);
    }

    public static AuthorizationResult allow() {
        return ALLOWED;
    }

    public static AuthorizationResult deny(String reason) {
        return new AuthorizationResult(false, reason, List.of());
    }

    public static AuthorizationResult denyMissingPermission(String permission) {
        return new AuthorizationResult(false, "Missing required permission: " + permission, List.of(permission));
    }
}
