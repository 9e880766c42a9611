package com.ryuqq.conductor.adapter.runner;

import java.time.Duration;
import java.util.Properties;

/**
 * OrchestraConductor 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>parallelism: 병렬 워크플로우 워커 수 (기본 8)</li>
 *   <li>autoApprovalPrefix: 즉시 승인으로 간주하는 승인 요청 ID 접두사 (기본 "auto-approved-")</li>
 *   <li>approvalTimeout: 승인 대기 상한 (기본 0 = 승인 엔진의 만료까지 대기)</li>
 * </ul>
 *
 * <p><strong>Properties 키:</strong></p>
 * <pre>
 * conductor.parallelism=8
 * conductor.approval.auto-prefix=auto-approved-
 * conductor.approval.timeout-ms=0
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param parallelism 워커 수 (1 이상)
 * @param autoApprovalPrefix 자동 승인 접두사 (빈 문자열 불가)
 * @param approvalTimeout 승인 대기 상한 (음수 불가, 0은 무제한)
 */
public record ConductorConfig(
    int parallelism,
    String autoApprovalPrefix,
    Duration approvalTimeout
) {

    public static final int DEFAULT_PARALLELISM = 8;
    public static final String DEFAULT_AUTO_APPROVAL_PREFIX = "auto-approved-";

    static final String KEY_PARALLELISM = "conductor.parallelism";
    static final String KEY_AUTO_APPROVAL_PREFIX = "conductor.approval.auto-prefix";
    static final String KEY_APPROVAL_TIMEOUT_MS = "conductor.approval.timeout-ms";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: parallelism=8, autoApprovalPrefix="auto-approved-", approvalTimeout=0 (무제한)</p>
     */
    public ConductorConfig() {
        this(DEFAULT_PARALLELISM, DEFAULT_AUTO_APPROVAL_PREFIX, Duration.ZERO);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ConductorConfig {
        if (parallelism <= 0) {
            throw new IllegalArgumentException(
                "parallelism must be positive (current: " + parallelism + ")"
            );
        }
        if (autoApprovalPrefix == null || autoApprovalPrefix.isBlank()) {
            throw new IllegalArgumentException("autoApprovalPrefix cannot be null or blank");
        }
        if (approvalTimeout == null) {
            throw new IllegalArgumentException("approvalTimeout cannot be null");
        }
        if (approvalTimeout.isNegative()) {
            throw new IllegalArgumentException(
                "approvalTimeout must not be negative (current: " + approvalTimeout + ")"
            );
        }
    }

    /**
     * Properties에서 설정 로드 (누락된 키는 기본값 유지).
     *
     * @param properties 설정 Properties
     * @return ConductorConfig 인스턴스
     * @throws IllegalArgumentException 값 형식이 잘못된 경우
     */
    public static ConductorConfig fromProperties(Properties properties) {
        ConductorConfig config = new ConductorConfig();
        if (properties == null) {
            return config;
        }
        String parallelism = properties.getProperty(KEY_PARALLELISM);
        if (parallelism != null) {
            config = config.withParallelism(parseInt(KEY_PARALLELISM, parallelism));
        }
        String prefix = properties.getProperty(KEY_AUTO_APPROVAL_PREFIX);
        if (prefix != null) {
            config = config.withAutoApprovalPrefix(prefix.trim());
        }
        String timeoutMs = properties.getProperty(KEY_APPROVAL_TIMEOUT_MS);
        if (timeoutMs != null) {
            config = config.withApprovalTimeout(Duration.ofMillis(parseLong(KEY_APPROVAL_TIMEOUT_MS, timeoutMs)));
        }
        return config;
    }

    /**
     * 승인 대기 상한 설정 여부.
     */
    public boolean hasApprovalTimeout() {
        return !approvalTimeout.isZero();
    }

    /**
     * parallelism만 변경한 새 인스턴스 생성.
     */
    public ConductorConfig withParallelism(int parallelism) {
        return new ConductorConfig(parallelism, autoApprovalPrefix, approvalTimeout);
    }

    /**
     * autoApprovalPrefix만 변경한 새 인스턴스 생성.
     */
    public ConductorConfig withAutoApprovalPrefix(String autoApprovalPrefix) {
        return new ConductorConfig(parallelism, autoApprovalPrefix, approvalTimeout);
    }

    /**
     * approvalTimeout만 변경한 새 인스턴스 생성.
     */
    public ConductorConfig withApprovalTimeout(Duration approvalTimeout) {
        return new ConductorConfig(parallelism, autoApprovalPrefix, approvalTimeout);
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer (current: " + value + ")", e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer (current: " + value + ")", e);
        }
    }
}
