package com.ryuqq.conductor.core.manifest;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 오케스트라 에이전트 선언.
 *
 * @param name 에이전트 이름
 * @param role 역할
 * @param description 설명
 * @param capabilities 기능 태그 목록
 * @param mcpServers 외부 도구 서버 참조 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentDefinition(
    String name,
    String role,
    String description,
    List<String> capabilities,
    List<String> mcpServers
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name이 null이거나 빈 문자열인 경우
     */
    public AgentDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("agent name cannot be null or blank");
        }
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        mcpServers = mcpServers == null ? null : List.copyOf(mcpServers);
    }

    /**
     * 외부 도구 참조 없이 에이전트 생성.
     */
    public static AgentDefinition of(String name, String role, String description, List<String> capabilities) {
        return new AgentDefinition(name, role, description, capabilities, null);
    }
}
