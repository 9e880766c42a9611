package com.ryuqq.conductor.core.manifest;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * 매니페스트 부가 정보.
 *
 * @param author 작성자 (null 가능)
 * @param tags 태그 목록 (null 가능)
 * @param priority 우선순위 (예: "low", "medium", "high", null 가능)
 * @param attributes 자유 형식 부가 속성 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ManifestMetadata(
    String author,
    List<String> tags,
    String priority,
    JsonNode attributes
) {

    public ManifestMetadata {
        tags = tags == null ? null : List.copyOf(tags);
        attributes = attributes == null ? null : attributes.deepCopy();
    }
}
