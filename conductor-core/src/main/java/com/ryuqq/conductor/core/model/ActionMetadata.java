package com.ryuqq.conductor.core.model;

import java.util.List;

/**
 * 액션 실행 메타데이터.
 *
 * @param executionTimeMs 진입부터 반환까지의 실행 시간 (밀리초, 0 이상)
 * @param agentsInvolved 참여한 에이전트 이름 목록
 * @param toolsUsed 사용한 도구 이름 목록
 * @param downstreamDomains 후속으로 트리거된 도메인 목록
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ActionMetadata(
    long executionTimeMs,
    List<String> agentsInvolved,
    List<String> toolsUsed,
    List<Domain> downstreamDomains
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException executionTimeMs가 음수인 경우
     */
    public ActionMetadata {
        if (executionTimeMs < 0) {
            throw new IllegalArgumentException("executionTimeMs must be non-negative (current: " + executionTimeMs + ")");
        }
        agentsInvolved = agentsInvolved == null ? List.of() : List.copyOf(agentsInvolved);
        toolsUsed = toolsUsed == null ? List.of() : List.copyOf(toolsUsed);
        downstreamDomains = downstreamDomains == null ? List.of() : List.copyOf(downstreamDomains);
    }

    /**
     * 실행 시간만 지정한 메타데이터 생성.
     *
     * @param executionTimeMs 실행 시간 (밀리초)
     * @return ActionMetadata 인스턴스
     */
    public static ActionMetadata timed(long executionTimeMs) {
        return new ActionMetadata(executionTimeMs, List.of(), List.of(), List.of());
    }

    /**
     * executionTimeMs만 변경한 새 인스턴스 생성.
     */
    public ActionMetadata withExecutionTimeMs(long executionTimeMs) {
        return new ActionMetadata(executionTimeMs, agentsInvolved, toolsUsed, downstreamDomains);
    }
}
