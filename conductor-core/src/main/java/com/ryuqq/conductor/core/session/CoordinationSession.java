package com.ryuqq.conductor.core.session;

import com.ryuqq.conductor.core.model.Domain;
import com.ryuqq.conductor.core.model.ExecutionContext;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 코디네이션 세션.
 *
 * <p>하나의 오케스트레이션 ID에 대한 생명주기 기록입니다. 단일 액션이 시작될 때 생성되며,
 * 교차 도메인 워크플로우에서는 같은 오케스트레이션 ID를 공유하는 모든 단계가 하나의 세션에
 * 참여합니다(참여 도메인이 늘어남).</p>
 *
 * <p><strong>동시성:</strong> 상태 변경과 참여 도메인 추가는 세션 단위로 동기화됩니다.
 * 종료 상태는 정확히 한 번만 설정되며, 이후 어떤 변경도 허용되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CoordinationSession {

    private final String orchestrationId;
    private final Domain initiatingDomain;
    private final Instant startedAt;
    private final ExecutionContext context;
    private final Set<Domain> involvedDomains;
    private SessionStatus status;
    private Instant endedAt;
    private String reason;

    private CoordinationSession(String orchestrationId, Domain initiatingDomain,
                                ExecutionContext context, Instant startedAt) {
        if (orchestrationId == null || orchestrationId.isBlank()) {
            throw new IllegalArgumentException("orchestrationId cannot be null or blank");
        }
        if (initiatingDomain == null) {
            throw new IllegalArgumentException("initiatingDomain cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (startedAt == null) {
            throw new IllegalArgumentException("startedAt cannot be null");
        }
        this.orchestrationId = orchestrationId;
        this.initiatingDomain = initiatingDomain;
        this.context = context;
        this.startedAt = startedAt;
        this.involvedDomains = EnumSet.of(initiatingDomain);
        this.status = SessionStatus.ACTIVE;
    }

    /**
     * ACTIVE 상태의 새 세션 생성.
     *
     * @param orchestrationId 오케스트레이션 ID
     * @param initiatingDomain 시작 도메인
     * @param context 원 실행 컨텍스트
     * @return 새 세션
     * @throws IllegalArgumentException 필수 값이 null인 경우
     */
    public static CoordinationSession start(String orchestrationId, Domain initiatingDomain, ExecutionContext context) {
        return new CoordinationSession(orchestrationId, initiatingDomain, context, Instant.now());
    }

    /**
     * 참여 도메인 추가.
     *
     * @param domain 참여 도메인
     * @return 새로 추가되었으면 true
     * @throws IllegalStateException 세션이 이미 종료된 경우
     */
    public synchronized boolean involve(Domain domain) {
        if (domain == null) {
            throw new IllegalArgumentException("domain cannot be null");
        }
        if (status.isTerminal()) {
            throw new IllegalStateException("Cannot involve " + domain + " in terminal session " + orchestrationId + " (" + status + ")");
        }
        return involvedDomains.add(domain);
    }

    /**
     * 종료 상태로 전이.
     *
     * @param terminal 종료 상태 (COMPLETED, FAILED, ABORTED)
     * @param reason 사유 (null 가능)
     * @throws IllegalStateException 이미 종료되었거나 유효하지 않은 전이인 경우
     */
    public synchronized void finish(SessionStatus terminal, String reason) {
        this.status = SessionTransition.transition(status, terminal);
        this.endedAt = Instant.now();
        this.reason = reason;
    }

    /**
     * 아직 ACTIVE이면 종료 상태로 전이.
     *
     * @param terminal 종료 상태
     * @param reason 사유 (null 가능)
     * @return 이번 호출로 전이되었으면 true, 이미 종료 상태였으면 false
     */
    public synchronized boolean finishIfActive(SessionStatus terminal, String reason) {
        if (status.isTerminal()) {
            return false;
        }
        finish(terminal, reason);
        return true;
    }

    public String getOrchestrationId() {
        return orchestrationId;
    }

    public Domain getInitiatingDomain() {
        return initiatingDomain;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public ExecutionContext getContext() {
        return context;
    }

    /**
     * 참여 도메인 스냅샷 (enum 순서).
     */
    public synchronized List<Domain> getInvolvedDomains() {
        return List.copyOf(involvedDomains);
    }

    public synchronized SessionStatus getStatus() {
        return status;
    }

    /**
     * 종료 시각 (ACTIVE이면 null).
     */
    public synchronized Instant getEndedAt() {
        return endedAt;
    }

    /**
     * 종료 사유 (없으면 null).
     */
    public synchronized String getReason() {
        return reason;
    }

    public synchronized boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }

    @Override
    public synchronized String toString() {
        return "CoordinationSession{orchestrationId=" + orchestrationId
            + ", initiatingDomain=" + initiatingDomain
            + ", involvedDomains=" + involvedDomains
            + ", status=" + status + "}";
    }
}
