package com.ryuqq.conductor.core.manifest;

import java.time.Instant;

/**
 * 레지스트리 엔트리.
 *
 * <p>검증된 매니페스트와 콘텐츠 해시, 등록 시각, 상태를 묶습니다.
 * 불변 레코드이며, 상태 변경은 엔트리 전체를 교체하는 방식으로 수행되어
 * 읽는 쪽이 절반만 갱신된 엔트리를 보지 않도록 합니다.</p>
 *
 * @param manifest 검증된 매니페스트
 * @param manifestHash 콘텐츠 해시 (64자 hex)
 * @param registeredAt 등록 시각
 * @param status 상태
 * @param errorMessage 오류 메시지 또는 비활성 사유 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RegistryEntry(
    OrchestraManifest manifest,
    String manifestHash,
    Instant registeredAt,
    ManifestStatus status,
    String errorMessage
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public RegistryEntry {
        if (manifest == null) {
            throw new IllegalArgumentException("manifest cannot be null");
        }
        if (manifestHash == null || manifestHash.isBlank()) {
            throw new IllegalArgumentException("manifestHash cannot be null or blank");
        }
        if (registeredAt == null) {
            throw new IllegalArgumentException("registeredAt cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
    }

    /**
     * 활성 엔트리 생성.
     */
    public static RegistryEntry active(OrchestraManifest manifest, String manifestHash, Instant registeredAt) {
        return new RegistryEntry(manifest, manifestHash, registeredAt, ManifestStatus.ACTIVE, null);
    }

    /**
     * 상태만 변경한 새 인스턴스 생성.
     */
    public RegistryEntry withStatus(ManifestStatus status, String errorMessage) {
        return new RegistryEntry(manifest, manifestHash, registeredAt, status, errorMessage);
    }

    /**
     * 활성 여부.
     */
    public boolean isActive() {
        return status == ManifestStatus.ACTIVE;
    }
}
