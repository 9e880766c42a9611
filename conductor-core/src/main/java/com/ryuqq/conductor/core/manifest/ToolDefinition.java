package com.ryuqq.conductor.core.manifest;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * 오케스트라 도구 선언.
 *
 * <p>입력/출력 형태는 JSON Schema 형식의 트리로 보관합니다. 키 순서는 해시에 영향을 주지 않습니다.</p>
 *
 * @param name 도구 이름
 * @param description 설명
 * @param inputSchema 입력 형태 기술자
 * @param outputSchema 출력 형태 기술자 (null 가능)
 * @param requiredPermissions 필요 권한 태그 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolDefinition(
    String name,
    String description,
    JsonNode inputSchema,
    JsonNode outputSchema,
    List<String> requiredPermissions
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name이 null이거나 빈 문자열인 경우
     */
    public ToolDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("tool name cannot be null or blank");
        }
        inputSchema = inputSchema == null ? null : inputSchema.deepCopy();
        outputSchema = outputSchema == null ? null : outputSchema.deepCopy();
        requiredPermissions = requiredPermissions == null ? null : List.copyOf(requiredPermissions);
    }
}
