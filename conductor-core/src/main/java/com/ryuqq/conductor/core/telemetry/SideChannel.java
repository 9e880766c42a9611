package com.ryuqq.conductor.core.telemetry;

import com.ryuqq.conductor.core.authorization.AuthorizationRequest;
import com.ryuqq.conductor.core.authorization.AuthorizationResult;
import com.ryuqq.conductor.core.manifest.OrchestraManifest;
import com.ryuqq.conductor.core.model.ActionRequest;
import com.ryuqq.conductor.core.model.ActionResult;
import com.ryuqq.conductor.core.model.Domain;
import com.ryuqq.conductor.core.model.ExecutionContext;
import com.ryuqq.conductor.core.session.CoordinationSession;
import com.ryuqq.conductor.core.session.SessionStatus;
import com.ryuqq.conductor.core.spi.audit.AuditEntry;
import com.ryuqq.conductor.core.spi.audit.AuditLogger;
import com.ryuqq.conductor.core.spi.audit.AuditSeverity;
import com.ryuqq.conductor.core.spi.event.EventEmitter;
import com.ryuqq.conductor.core.spi.event.OrchestraEvent;
import com.ryuqq.conductor.core.spi.event.OrchestraEventType;
import com.ryuqq.conductor.core.spi.metrics.MetricsSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 감사/이벤트/메트릭 사이드 채널.
 *
 * <p>레지스트리, 인가기, 컨덕터가 부수 효과를 기록하는 단일 통로입니다.
 * 모든 호출은 fire-and-forget이며, 협력자가 던진 예외는 WARN 로그로 남기고 삼킵니다.
 * 사이드 채널 실패는 기록 대상 작업의 결과를 절대 바꾸지 않습니다.</p>
 *
 * <p><strong>리소스 표기:</strong></p>
 * <ul>
 *   <li>매니페스트: {@code orchestra://manifests/<domain>}</li>
 *   <li>액션: {@code orchestra://<domain>/actions/<action>}</li>
 *   <li>코디네이션: {@code orchestra://coordination/<orchestrationId>}</li>
 *   <li>교차 인가: {@code orchestra://<source>/cross-auth/<target>}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SideChannel {

    private static final Logger log = LoggerFactory.getLogger(SideChannel.class);

    private static final String SYSTEM = "system";
    private static final String OPERATION_COORDINATE_ACTION = "coordinate_action";

    private final AuditLogger auditLogger;
    private final EventEmitter eventEmitter;
    private final MetricsSink metricsSink;

    /**
     * SideChannel 생성.
     *
     * @param auditLogger 감사 로거
     * @param eventEmitter 이벤트 발행기
     * @param metricsSink 메트릭 싱크
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public SideChannel(AuditLogger auditLogger, EventEmitter eventEmitter, MetricsSink metricsSink) {
        if (auditLogger == null) {
            throw new IllegalArgumentException("auditLogger cannot be null");
        }
        if (eventEmitter == null) {
            throw new IllegalArgumentException("eventEmitter cannot be null");
        }
        if (metricsSink == null) {
            throw new IllegalArgumentException("metricsSink cannot be null");
        }
        this.auditLogger = auditLogger;
        this.eventEmitter = eventEmitter;
        this.metricsSink = metricsSink;
    }

    /**
     * 아무것도 기록하지 않는 사이드 채널.
     */
    public static SideChannel noop() {
        return new SideChannel(AuditLogger.noop(), EventEmitter.noop(), MetricsSink.noop());
    }

    // ========== 매니페스트 ==========

    /**
     * 매니페스트 등록 성공 기록.
     *
     * @param manifest 등록된 매니페스트
     * @param manifestHash 콘텐츠 해시
     */
    public void manifestRegistered(OrchestraManifest manifest, String manifestHash) {
        Domain domain = manifest.domain();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("domain", domain.getId());
        details.put("manifestName", manifest.name());
        details.put("manifestVersion", manifest.version());
        details.put("manifestHash", manifestHash);
        details.put("status", "success");
        details.put("agentsCount", manifest.agents().size());
        details.put("toolsCount", manifest.tools().size());
        details.put("policiesCount", manifest.policies().size());
        details.put("dependencies", manifest.dependenciesOrEmpty().stream().map(Domain::getId).toList());

        audit(new AuditEntry(null, SYSTEM, "orchestra.manifest.registered", manifestResource(domain),
            AuditEntry.CATEGORY, AuditSeverity.INFO, details, Instant.now()));
        publish(OrchestraEvent.of(OrchestraEventType.MANIFEST_REGISTERED, domain, null, null, details));
        increment(MetricNames.MANIFESTS_REGISTERED, Map.of("domain", domain.getId(), "status", "success"));
        setGauge(MetricNames.AGENTS_ACTIVE, Map.of("domain", domain.getId()), manifest.agents().size());
    }

    /**
     * 매니페스트 검증 실패 기록 (레지스트리 상태는 변경되지 않음).
     *
     * @param domainId 원본 매니페스트의 도메인 문자열 (알 수 없으면 null)
     * @param errors 검증 오류 목록
     */
    public void manifestRejected(String domainId, List<String> errors) {
        String tag = domainId == null || domainId.isBlank() ? "unknown" : domainId;
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("domain", tag);
        details.put("status", "failed");
        details.put("errors", List.copyOf(errors));

        audit(new AuditEntry(null, SYSTEM, "orchestra.manifest.registered", "orchestra://manifests/" + tag,
            AuditEntry.CATEGORY, AuditSeverity.WARN, details, Instant.now()));
        // 이벤트는 도메인이 필수이므로 알 수 없는 도메인은 감사와 메트릭만 남김
        Domain.find(domainId).ifPresent(domain ->
            publish(OrchestraEvent.of(OrchestraEventType.MANIFEST_REGISTERED, domain, null, null, details)));
        increment(MetricNames.MANIFESTS_REGISTERED, Map.of("domain", tag, "status", "failed"));
        increment(MetricNames.ERRORS, Map.of("domain", tag, "error_code", "MANIFEST_INVALID",
            "operation", "register_manifest"));
        log.debug("Manifest for {} rejected with {} error(s)", tag, errors.size());
    }

    /**
     * 매니페스트 비활성화 기록.
     */
    public void manifestDisabled(Domain domain, String reason) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("domain", domain.getId());
        details.put("reason", reason);
        audit(new AuditEntry(null, SYSTEM, "orchestra.manifest.disabled", manifestResource(domain),
            AuditEntry.CATEGORY, AuditSeverity.WARN, details, Instant.now()));
        publish(OrchestraEvent.of(OrchestraEventType.MANIFEST_DISABLED, domain, null, null, details));
        setGauge(MetricNames.AGENTS_ACTIVE, Map.of("domain", domain.getId()), 0);
    }

    /**
     * 매니페스트 재활성화 기록.
     */
    public void manifestEnabled(OrchestraManifest manifest) {
        Domain domain = manifest.domain();
        audit(new AuditEntry(null, SYSTEM, "orchestra.manifest.enabled", manifestResource(domain),
            AuditEntry.CATEGORY, AuditSeverity.INFO, Map.of("domain", domain.getId()), Instant.now()));
        setGauge(MetricNames.AGENTS_ACTIVE, Map.of("domain", domain.getId()), manifest.agents().size());
    }

    /**
     * 활성 오케스트라 수 갱신.
     */
    public void activeOrchestras(int count) {
        setGauge(MetricNames.ORCHESTRAS_ACTIVE, Map.of(), count);
    }

    // ========== 교차 인가 ==========

    /**
     * 교차 인가 결정 기록 (허용/거부 모두).
     */
    public void authorizationChecked(AuthorizationRequest request, AuthorizationResult result) {
        ExecutionContext context = request.context();
        String source = request.sourceDomain().getId();
        String target = request.targetDomain().getId();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("sourceDomain", source);
        details.put("targetDomain", target);
        details.put("action", request.action());
        details.put("allowed", result.allowed());
        details.put("reason", result.reason());
        details.put("traceId", context.traceId());

        audit(new AuditEntry(context.tenantId(), subjectOf(context),
            result.allowed() ? "orchestra.cross_auth.granted" : "orchestra.cross_auth.denied",
            "orchestra://" + source + "/cross-auth/" + target,
            AuditEntry.CATEGORY, result.allowed() ? AuditSeverity.INFO : AuditSeverity.WARN,
            details, Instant.now()));
        publish(OrchestraEvent.of(OrchestraEventType.CROSS_AUTH_CHECKED, request.sourceDomain(),
            context.tenantId(), context.orchestrationId(), details));
        increment(MetricNames.CROSS_AUTH_CHECKS, Map.of(
            "source_domain", source,
            "target_domain", target,
            "result", result.allowed() ? "granted" : "denied"));
    }

    // ========== 액션 ==========

    /**
     * 단일 액션 결과 기록 (게이트 거부 포함).
     *
     * @param request 원 요청
     * @param result 반환될 결과
     * @param duration 진입부터 반환까지의 시간
     */
    public void actionRecorded(ActionRequest request, ActionResult result, Duration duration) {
        ExecutionContext context = request.context();
        String domain = request.domain().getId();
        String status = result.success() ? "success" : "failed";

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("domain", domain);
        details.put("actionName", request.action());
        details.put("arguments", request.arguments().asMap());
        details.put("success", result.success());
        details.put("executionTimeMs", result.metadata().executionTimeMs());
        details.put("agentsInvolved", result.metadata().agentsInvolved());
        details.put("toolsUsed", result.metadata().toolsUsed());
        if (result.error() != null) {
            details.put("errorCode", result.error().code());
            details.put("errorMessage", result.error().message());
        }
        details.put("traceId", context.traceId());
        details.put("orchestrationId", context.orchestrationId());

        audit(new AuditEntry(context.tenantId(), subjectOf(context),
            result.success() ? "orchestra.action.completed" : "orchestra.action.failed",
            "orchestra://" + domain + "/actions/" + request.action(),
            AuditEntry.CATEGORY, result.success() ? AuditSeverity.INFO : AuditSeverity.ERROR,
            details, Instant.now()));
        publish(OrchestraEvent.of(
            result.success() ? OrchestraEventType.ACTION_COMPLETED : OrchestraEventType.ACTION_FAILED,
            request.domain(), context.tenantId(), context.orchestrationId(), details));

        Map<String, String> tags = Map.of("domain", domain, "action", request.action(), "status", status);
        increment(MetricNames.ACTIONS, tags);
        recordDuration(MetricNames.ACTION_DURATION, tags, duration);
        result.errorCode().ifPresent(code -> increment(MetricNames.ERRORS, Map.of(
            "domain", domain, "error_code", code, "operation", OPERATION_COORDINATE_ACTION)));
    }

    // ========== 코디네이션 ==========

    /**
     * 새 세션 시작 기록.
     */
    public void coordinationStarted(CoordinationSession session) {
        publish(OrchestraEvent.of(OrchestraEventType.COORDINATION_STARTED, session.getInitiatingDomain(),
            session.getContext().tenantId(), session.getOrchestrationId(), sessionDetails(session)));
    }

    /**
     * 세션 종료(COMPLETED/FAILED) 기록.
     */
    public void coordinationEnded(CoordinationSession session) {
        boolean failed = session.getStatus() != SessionStatus.COMPLETED;
        Map<String, Object> details = sessionDetails(session);
        audit(new AuditEntry(session.getContext().tenantId(), subjectOf(session.getContext()),
            failed ? "orchestra.coordination.failed" : "orchestra.coordination.completed",
            coordinationResource(session), AuditEntry.CATEGORY,
            failed ? AuditSeverity.ERROR : AuditSeverity.INFO, details, Instant.now()));
        publish(OrchestraEvent.of(OrchestraEventType.COORDINATION_COMPLETED, session.getInitiatingDomain(),
            session.getContext().tenantId(), session.getOrchestrationId(), details));
    }

    /**
     * 운영자 중단 기록.
     */
    public void coordinationAborted(CoordinationSession session) {
        Map<String, Object> details = sessionDetails(session);
        audit(new AuditEntry(session.getContext().tenantId(), subjectOf(session.getContext()),
            "orchestra.coordination.aborted", coordinationResource(session), AuditEntry.CATEGORY,
            AuditSeverity.WARN, details, Instant.now()));
        publish(OrchestraEvent.of(OrchestraEventType.COORDINATION_ABORTED, session.getInitiatingDomain(),
            session.getContext().tenantId(), session.getOrchestrationId(), details));
    }

    /**
     * 워크플로우 시작 (활성 세션 게이지 +1).
     */
    public void workflowStarted() {
        adjustGauge(MetricNames.COORDINATION_SESSIONS_ACTIVE, Map.of(), 1);
    }

    /**
     * 워크플로우 종료 (게이지 -1, 소요 시간 및 카운터 기록).
     *
     * @param session 종료된 워크플로우 세션
     * @param parallel 병렬 실행 여부
     * @param duration 워크플로우 소요 시간
     */
    public void workflowEnded(CoordinationSession session, boolean parallel, Duration duration) {
        adjustGauge(MetricNames.COORDINATION_SESSIONS_ACTIVE, Map.of(), -1);
        String status = session.getStatus() == SessionStatus.COMPLETED ? "success" : "failed";
        String initiating = session.getInitiatingDomain().getId();
        recordDuration(MetricNames.COORDINATION_DURATION, Map.of(
            "initiating_domain", initiating,
            "involved_count", String.valueOf(session.getInvolvedDomains().size()),
            "status", status), duration);
        increment(MetricNames.COORDINATIONS, Map.of(
            "initiating_domain", initiating,
            "status", status,
            "parallel", String.valueOf(parallel)));
    }

    // ========== 저수준 (예외 격리) ==========

    public void audit(AuditEntry entry) {
        try {
            auditLogger.log(entry);
        } catch (RuntimeException e) {
            log.warn("Audit logging failed for {}: {}", entry.action(), e.getMessage(), e);
        }
    }

    public void publish(OrchestraEvent event) {
        try {
            eventEmitter.publish(event);
        } catch (RuntimeException e) {
            log.warn("Event publishing failed for {}: {}", event.type().getValue(), e.getMessage(), e);
        }
    }

    public void increment(String name, Map<String, String> tags) {
        try {
            metricsSink.increment(name, tags);
        } catch (RuntimeException e) {
            log.warn("Metric increment failed for {}: {}", name, e.getMessage(), e);
        }
    }

    public void setGauge(String name, Map<String, String> tags, double value) {
        try {
            metricsSink.setGauge(name, tags, value);
        } catch (RuntimeException e) {
            log.warn("Gauge update failed for {}: {}", name, e.getMessage(), e);
        }
    }

    public void adjustGauge(String name, Map<String, String> tags, double delta) {
        try {
            metricsSink.adjustGauge(name, tags, delta);
        } catch (RuntimeException e) {
            log.warn("Gauge adjustment failed for {}: {}", name, e.getMessage(), e);
        }
    }

    public void recordDuration(String name, Map<String, String> tags, Duration duration) {
        try {
            metricsSink.recordDuration(name, tags, duration);
        } catch (RuntimeException e) {
            log.warn("Duration recording failed for {}: {}", name, e.getMessage(), e);
        }
    }

    // ========== helpers ==========

    private static String subjectOf(ExecutionContext context) {
        return context.userId() == null || context.userId().isBlank() ? SYSTEM : context.userId();
    }

    private static String manifestResource(Domain domain) {
        return "orchestra://manifests/" + domain.getId();
    }

    private static String coordinationResource(CoordinationSession session) {
        return "orchestra://coordination/" + session.getOrchestrationId();
    }

    private static Map<String, Object> sessionDetails(CoordinationSession session) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("orchestrationId", session.getOrchestrationId());
        details.put("initiatingDomain", session.getInitiatingDomain().getId());
        details.put("involvedDomains", session.getInvolvedDomains().stream().map(Domain::getId).toList());
        details.put("status", session.getStatus().wireName());
        details.put("startedAt", session.getStartedAt().toString());
        details.put("traceId", session.getContext().traceId());
        return details;
    }
}
