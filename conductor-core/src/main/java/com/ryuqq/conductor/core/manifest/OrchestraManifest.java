package com.ryuqq.conductor.core.manifest;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ryuqq.conductor.core.model.Domain;

import java.util.List;

/**
 * 도메인 오케스트라 매니페스트.
 *
 * <p>도메인의 에이전트, 도구, 정책, 의존성을 선언합니다.
 * (domain, version) 쌍이 매니페스트 리비전을 식별하며,
 * 도메인당 최대 하나의 매니페스트만 활성 상태입니다.</p>
 *
 * <p><strong>유효성 검증:</strong> 구조 검증은 {@link ManifestValidator}가 원본 JSON에 대해 수행하며,
 * 이 레코드는 필수 필드 null 여부만 확인합니다.</p>
 *
 * @param name 매니페스트 이름
 * @param version 시맨틱 버전 (예: 1.0.0)
 * @param domain 도메인
 * @param description 설명
 * @param agents 에이전트 목록 (1개 이상, 순서 유지)
 * @param tools 도구 목록
 * @param policies 정책 목록
 * @param dependencies 의존 도메인 목록 (null 가능)
 * @param mcpServers 외부 서버 참조 (null 가능)
 * @param metadata 부가 정보 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrchestraManifest(
    String name,
    String version,
    Domain domain,
    String description,
    List<AgentDefinition> agents,
    List<ToolDefinition> tools,
    List<PolicyDefinition> policies,
    List<Domain> dependencies,
    List<String> mcpServers,
    ManifestMetadata metadata
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name, version, domain이 null인 경우
     */
    public OrchestraManifest {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("version cannot be null or blank");
        }
        if (domain == null) {
            throw new IllegalArgumentException("domain cannot be null");
        }
        agents = agents == null ? List.of() : List.copyOf(agents);
        tools = tools == null ? List.of() : List.copyOf(tools);
        policies = policies == null ? List.of() : List.copyOf(policies);
        dependencies = dependencies == null ? null : List.copyOf(dependencies);
        mcpServers = mcpServers == null ? null : List.copyOf(mcpServers);
    }

    /**
     * 의존 도메인 목록 (없으면 빈 목록).
     *
     * @return 의존 도메인 목록
     */
    public List<Domain> dependenciesOrEmpty() {
        return dependencies == null ? List.of() : dependencies;
    }
}
