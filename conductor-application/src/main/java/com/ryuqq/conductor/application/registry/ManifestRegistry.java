package com.ryuqq.conductor.application.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.conductor.core.manifest.OrchestraManifest;
import com.ryuqq.conductor.core.manifest.RegistryEntry;
import com.ryuqq.conductor.core.model.Domain;

import java.util.List;
import java.util.Optional;

/**
 * 오케스트라 매니페스트 레지스트리.
 *
 * <p>도메인당 최대 하나의 등록 항목을 유지합니다. 재등록은 이전 항목을 덮어씁니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>같은 도메인에 대한 쓰기는 직렬화 (항목 전체를 원자적으로 교체)</li>
 *   <li>서로 다른 도메인에 대한 쓰기는 독립적</li>
 *   <li>검증 실패 시 상태 변경 없음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ManifestRegistry {

    /**
     * 원본(JSON 트리) 매니페스트 등록.
     *
     * @param rawManifest 원본 매니페스트
     * @return 등록 결과 (검증 실패 시 오류 목록 포함)
     */
    RegistrationResult register(JsonNode rawManifest);

    /**
     * 타입이 지정된 매니페스트 등록 (동일한 구조 검증을 거침).
     *
     * @param manifest 매니페스트
     * @return 등록 결과
     */
    RegistrationResult register(OrchestraManifest manifest);

    /**
     * 도메인 항목 조회.
     */
    Optional<RegistryEntry> getByDomain(Domain domain);

    /**
     * ACTIVE 항목 목록 (도메인 enum 순서).
     */
    List<RegistryEntry> listActive();

    /**
     * 등록된 도메인 목록 (상태 무관, enum 순서).
     */
    List<Domain> listDomains();

    /**
     * 도메인 비활성화.
     *
     * @param domain 도메인
     * @param reason 사유 (null이면 "Manual disable")
     * @return 등록된 도메인이면 true
     */
    boolean disable(Domain domain, String reason);

    /**
     * 비활성화된 도메인 재활성화.
     *
     * @param domain 도메인
     * @return 등록된 도메인이면 true
     */
    boolean enable(Domain domain);

    /**
     * 도메인 활성 여부 (미등록이면 false).
     */
    boolean isActive(Domain domain);

    /**
     * 선언된 직접 의존 도메인 (미등록이면 빈 목록).
     */
    List<Domain> getDependencies(Domain domain);

    /**
     * 모든 직접 의존 도메인이 ACTIVE인지 확인 (단일 단계, 전이적 검사 없음).
     */
    boolean validateDependencies(Domain domain);

    /**
     * ACTIVE가 아닌 직접 의존 도메인 목록.
     */
    List<Domain> getMissingDependencies(Domain domain);

    /**
     * 모든 항목 제거 (테스트 초기화).
     */
    void clear();
}
