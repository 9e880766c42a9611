package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.application.authorization.CrossOrchestraAuthorizer;
import com.ryuqq.conductor.application.conductor.Conductor;
import com.ryuqq.conductor.application.registry.ManifestRegistry;
import com.ryuqq.conductor.core.authorization.AuthorizationRequest;
import com.ryuqq.conductor.core.authorization.AuthorizationResult;
import com.ryuqq.conductor.core.manifest.RegistryEntry;
import com.ryuqq.conductor.core.model.ActionRequest;
import com.ryuqq.conductor.core.model.ActionResult;
import com.ryuqq.conductor.core.model.Domain;
import com.ryuqq.conductor.core.model.ErrorCodes;
import com.ryuqq.conductor.core.model.ExecutionContext;
import com.ryuqq.conductor.core.session.CoordinationSession;
import com.ryuqq.conductor.core.session.SessionStatus;
import com.ryuqq.conductor.core.spi.DomainExecutor;
import com.ryuqq.conductor.core.spi.SessionStore;
import com.ryuqq.conductor.core.spi.approval.ApprovalDecision;
import com.ryuqq.conductor.core.spi.approval.ApprovalEngine;
import com.ryuqq.conductor.core.spi.approval.ApprovalRequest;
import com.ryuqq.conductor.core.spi.approval.RiskClassifier;
import com.ryuqq.conductor.core.spi.approval.RiskLevel;
import com.ryuqq.conductor.core.spi.policy.PolicyDecision;
import com.ryuqq.conductor.core.spi.policy.PolicyDenial;
import com.ryuqq.conductor.core.spi.policy.PolicyEnforcer;
import com.ryuqq.conductor.core.spi.policy.PolicyRequest;
import com.ryuqq.conductor.core.telemetry.SideChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link Conductor} 구현체.
 *
 * <p>액션 요청을 거버넌스 게이트에 순서대로 통과시킨 뒤 도메인 실행기로 디스패치합니다.
 * 각 게이트는 실패 시 즉시 실패 결과를 반환하며, 반환 전에 감사/이벤트/메트릭을 기록합니다.</p>
 *
 * <p><strong>단일 액션 파이프라인:</strong></p>
 * <ol>
 *   <li>존재 → ORCHESTRA_NOT_FOUND</li>
 *   <li>활성 → ORCHESTRA_DISABLED</li>
 *   <li>의존성 (단일 단계) → DEPENDENCIES_MISSING</li>
 *   <li>상위 도메인 교차 인가 (parentDomain 지정 시) → CROSS_ORCHESTRA_DENIED</li>
 *   <li>정책 → 정책 엔진의 코드 (예외는 POLICY_DENIED)</li>
 *   <li>위험도/승인 → HITL_DENIED, HITL_FAILED</li>
 *   <li>세션 참여 또는 생성</li>
 *   <li>디스패치 → NOT_IMPLEMENTED, EXECUTION_ERROR, 실행기 결과</li>
 *   <li>소유 세션 종료 (COMPLETED/FAILED)</li>
 *   <li>기록 (감사, 이벤트, 메트릭)</li>
 * </ol>
 *
 * <p><strong>세션 소유:</strong> 워크플로우 단계는 워크플로우 세션에 참여만 하고 종료하지 않습니다.
 * 단일 액션은 같은 orchestrationId의 ACTIVE 세션이 있으면 그 세션에 참여하고, 없으면 새 세션을 열어
 * 액션이 끝날 때 직접 종료합니다. 중단(ABORTED)된 세션에 참여하려는 단계는 디스패치되지 않습니다.</p>
 *
 * <p><strong>스레드 모델:</strong></p>
 * <ul>
 *   <li>coordinateAction은 호출 스레드에서 실행</li>
 *   <li>병렬 워크플로우는 고정 크기 워커 풀 ({@link ConductorConfig#parallelism()})</li>
 *   <li>승인 대기 상한이 설정된 경우 대기는 별도 스레드에서 수행되고 호출 스레드는 상한까지만 대기</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * OrchestraConductor conductor = OrchestraConductor.builder()
 *     .registry(registry)
 *     .authorizer(authorizer)
 *     .sessionStore(new InMemorySessionStore())
 *     .executor(new FinanceExecutor())
 *     .policyEnforcer(policyEnforcer)
 *     .riskClassifier(riskClassifier)
 *     .approvalEngine(approvalEngine)
 *     .sideChannel(sideChannel)
 *     .config(new ConductorConfig())
 *     .build();
 *
 * ActionResult result = conductor.coordinateAction(request);
 * ...
 * conductor.shutdown();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class OrchestraConductor implements Conductor {

    private static final Logger log = LoggerFactory.getLogger(OrchestraConductor.class);

    private static final String SYSTEM = "system";

    private final ManifestRegistry registry;
    private final CrossOrchestraAuthorizer authorizer;
    private final SessionStore sessionStore;
    private final ConcurrentHashMap<Domain, DomainExecutor> executors;
    private final PolicyEnforcer policyEnforcer;
    private final RiskClassifier riskClassifier;
    private final ApprovalEngine approvalEngine;
    private final SideChannel sideChannel;
    private final ConductorConfig config;
    private final ExecutorService workerPool;
    private final ExecutorService approvalWaiters;

    private OrchestraConductor(Builder builder) {
        if (builder.registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (builder.authorizer == null) {
            throw new IllegalArgumentException("authorizer cannot be null");
        }
        if (builder.sessionStore == null) {
            throw new IllegalArgumentException("sessionStore cannot be null");
        }
        this.registry = builder.registry;
        this.authorizer = builder.authorizer;
        this.sessionStore = builder.sessionStore;
        this.policyEnforcer = builder.policyEnforcer;
        this.riskClassifier = builder.riskClassifier;
        this.approvalEngine = builder.approvalEngine;
        this.sideChannel = builder.sideChannel;
        this.config = builder.config;
        this.executors = new ConcurrentHashMap<>();
        builder.executors.forEach(this::registerExecutor);
        this.workerPool = Executors.newFixedThreadPool(config.parallelism(), namedDaemonThreads("conductor-worker-"));
        this.approvalWaiters = Executors.newCachedThreadPool(namedDaemonThreads("conductor-approval-"));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 도메인 실행기 등록 (같은 도메인은 교체).
     *
     * @param executor 도메인 실행기
     * @throws IllegalArgumentException executor 또는 executor.domain()이 null인 경우
     */
    public void registerExecutor(DomainExecutor executor) {
        if (executor == null || executor.domain() == null) {
            throw new IllegalArgumentException("executor and its domain cannot be null");
        }
        DomainExecutor previous = executors.put(executor.domain(), executor);
        if (previous != null) {
            log.info("Domain executor replaced: {}", executor.domain());
        }
    }

    // ========== 단일 액션 ==========

    @Override
    public ActionResult coordinateAction(ActionRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        return conduct(request, null);
    }

    /**
     * 게이트 파이프라인 실행.
     *
     * @param request 요청
     * @param workflowSession 워크플로우 단계이면 그 워크플로우의 세션, 단일 액션이면 null
     */
    private ActionResult conduct(ActionRequest request, CoordinationSession workflowSession) {
        long startNanos = System.nanoTime();

        String orchestrationId = request.context().findOrchestrationId()
            .orElseGet(() -> UUID.randomUUID().toString());
        ActionRequest governed = request.withContext(request.context().withOrchestrationId(orchestrationId));

        log.info("Conducting action: {} (orchestrationId={})", governed.actionType(), orchestrationId);

        CoordinationSession ownedSession = null;
        ActionResult result;
        try {
            Optional<ActionResult> rejection = checkRegistry(governed)
                .or(() -> checkCrossOrchestra(governed))
                .or(() -> checkPolicy(governed))
                .or(() -> checkApproval(governed));

            if (rejection.isPresent()) {
                result = rejection.get();
            } else if (workflowSession != null) {
                result = joinAndDispatch(workflowSession, governed);
            } else {
                CoordinationSession candidate = CoordinationSession.start(
                    orchestrationId, governed.domain(), governed.context());
                CoordinationSession session = sessionStore.saveIfAbsentOrTerminal(candidate);
                if (session == candidate) {
                    ownedSession = session;
                    sideChannel.coordinationStarted(session);
                    result = dispatch(governed);
                } else {
                    result = joinAndDispatch(session, governed);
                }
            }
        } catch (RuntimeException e) {
            log.error("Action failed: {} (orchestrationId={})", governed.actionType(), orchestrationId, e);
            result = ActionResult.failed(governed, ErrorCodes.EXECUTION_ERROR, describe(e), 0);
        }

        if (ownedSession != null) {
            completeOwnedSession(ownedSession, result);
        }
        return record(governed, result, startNanos);
    }

    private Optional<ActionResult> checkRegistry(ActionRequest request) {
        Domain domain = request.domain();
        Optional<RegistryEntry> entry = registry.getByDomain(domain);
        if (entry.isEmpty()) {
            return reject(request, ErrorCodes.ORCHESTRA_NOT_FOUND, "Orchestra not found for domain: " + domain);
        }
        if (!entry.get().isActive()) {
            return reject(request, ErrorCodes.ORCHESTRA_DISABLED,
                "Orchestra is " + entry.get().status().wireName() + ": " + domain);
        }
        List<Domain> missing = registry.getMissingDependencies(domain);
        if (!missing.isEmpty()) {
            return reject(request, ErrorCodes.DEPENDENCIES_MISSING,
                "Missing dependencies for " + domain + ": " + joinIds(missing));
        }
        return Optional.empty();
    }

    private Optional<ActionResult> checkCrossOrchestra(ActionRequest request) {
        ExecutionContext context = request.context();
        Domain parent = context.parentDomain();
        if (parent == null || parent == request.domain()) {
            return Optional.empty();
        }
        AuthorizationResult authorization = authorizer.authorize(
            new AuthorizationRequest(parent, request.domain(), request.action(), context));
        if (!authorization.allowed()) {
            return reject(request, ErrorCodes.CROSS_ORCHESTRA_DENIED, authorization.reason());
        }
        return Optional.empty();
    }

    private Optional<ActionResult> checkPolicy(ActionRequest request) {
        PolicyDecision decision;
        try {
            decision = policyEnforcer.evaluate(PolicyRequest.from(request));
        } catch (RuntimeException e) {
            log.warn("Policy evaluation failed for {}: {}", request.actionType(), describe(e), e);
            return reject(request, ErrorCodes.POLICY_DENIED, "Policy evaluation failed: " + describe(e));
        }
        if (decision == null) {
            return reject(request, ErrorCodes.POLICY_DENIED, "Policy enforcer returned no decision");
        }
        if (decision instanceof PolicyDenial denial) {
            log.warn("Policy denied {}: {} ({})", request.actionType(), denial.reason(), denial.code());
            return reject(request, denial.code(), denial.reason());
        }
        return Optional.empty();
    }

    private Optional<ActionResult> checkApproval(ActionRequest request) {
        String actionType = request.actionType();
        RiskLevel riskLevel;
        try {
            riskLevel = riskClassifier.classify(actionType, request.context());
        } catch (RuntimeException e) {
            return reject(request, ErrorCodes.HITL_FAILED, "Risk classification failed: " + describe(e));
        }
        if (riskLevel == null || !riskClassifier.requiresApproval(riskLevel)) {
            return Optional.empty();
        }
        if (approvalEngine == null) {
            return reject(request, ErrorCodes.HITL_FAILED,
                "Human approval failed: no approval engine configured for " + riskLevel + " risk action");
        }

        log.info("High-risk action requires human approval: {} ({})", actionType, riskLevel);
        String requestId;
        try {
            requestId = approvalEngine.requestApproval(toApprovalRequest(request, riskLevel));
        } catch (RuntimeException e) {
            log.error("Approval request failed for {}", actionType, e);
            return reject(request, ErrorCodes.HITL_FAILED, "Human approval failed: " + describe(e));
        }

        if (requestId != null && requestId.startsWith(config.autoApprovalPrefix())) {
            log.debug("Action auto-approved: {} ({})", actionType, riskLevel);
            return Optional.empty();
        }

        log.info("Waiting for human approval: {} (approvalRequestId={})", actionType, requestId);
        ApprovalDecision decision;
        try {
            decision = awaitApproval(requestId);
        } catch (ApprovalWaitException e) {
            log.error("Approval wait failed for {} (approvalRequestId={}): {}", actionType, requestId, e.getMessage());
            return reject(request, ErrorCodes.HITL_FAILED, "Human approval failed: " + e.getMessage());
        }

        if (decision == null || !decision.isApproved()) {
            String reason = decision == null
                ? "no decision"
                : decision.reason() != null ? decision.reason() : decision.decision().name();
            log.warn("Action denied by human approver: {} (approvalRequestId={})", actionType, requestId);
            return reject(request, ErrorCodes.HITL_DENIED, "Action denied by human approver: " + reason);
        }
        log.info("Action approved by human approver: {} (approvalRequestId={})", actionType, requestId);
        return Optional.empty();
    }

    private ApprovalRequest toApprovalRequest(ActionRequest request, RiskLevel riskLevel) {
        ExecutionContext context = request.context();
        String requester = context.userId() != null && !context.userId().isBlank()
            ? context.userId()
            : context.tenantId();

        Map<String, Object> approvalContext = new LinkedHashMap<>();
        approvalContext.put("orchestrationId", context.orchestrationId());
        approvalContext.put("domain", request.domain().getId());
        approvalContext.put("action", request.action());
        approvalContext.put("arguments", request.arguments().asMap());

        return new ApprovalRequest(
            request.actionType(),
            requester == null || requester.isBlank() ? SYSTEM : requester,
            context.tenantId(),
            "Orchestra action: " + request.actionType(),
            List.of("orchestra://" + request.domain().getId() + "/" + request.action()),
            riskLevel,
            approvalContext
        );
    }

    /**
     * 승인 대기. 상한이 없으면 호출 스레드에서 엔진이 결정할 때까지 블로킹합니다.
     */
    private ApprovalDecision awaitApproval(String requestId) throws ApprovalWaitException {
        if (!config.hasApprovalTimeout()) {
            try {
                return approvalEngine.waitForApproval(requestId);
            } catch (RuntimeException e) {
                throw new ApprovalWaitException(describe(e), e);
            }
        }

        Future<ApprovalDecision> waiting =
            approvalWaiters.submit(() -> approvalEngine.waitForApproval(requestId));
        long timeoutMs = config.approvalTimeout().toMillis();
        try {
            return waiting.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            waiting.cancel(true);
            throw new ApprovalWaitException("approval wait timed out after " + timeoutMs + "ms", e);
        } catch (InterruptedException e) {
            waiting.cancel(true);
            Thread.currentThread().interrupt();
            throw new ApprovalWaitException("approval wait interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ApprovalWaitException(describe(cause), cause);
        }
    }

    private ActionResult joinAndDispatch(CoordinationSession session, ActionRequest request) {
        try {
            session.involve(request.domain());
        } catch (IllegalStateException e) {
            log.warn("Coordination session {} is no longer active, {} not dispatched",
                session.getOrchestrationId(), request.actionType());
            return ActionResult.failed(request, ErrorCodes.EXECUTION_ERROR,
                "Coordination session is no longer active: " + session.getOrchestrationId()
                    + " (" + session.getStatus().wireName() + ")", 0);
        }
        return dispatch(request);
    }

    private ActionResult dispatch(ActionRequest request) {
        DomainExecutor executor = executors.get(request.domain());
        if (executor == null) {
            return ActionResult.failed(request, ErrorCodes.NOT_IMPLEMENTED,
                "No executor registered for domain: " + request.domain(), 0);
        }
        try {
            ActionResult result = executor.execute(request);
            if (result == null) {
                return ActionResult.failed(request, ErrorCodes.EXECUTION_ERROR,
                    "Executor returned no result for " + request.actionType(), 0);
            }
            return result;
        } catch (RuntimeException e) {
            log.error("Executor for {} threw while running {}", request.domain(), request.actionType(), e);
            return ActionResult.failed(request, ErrorCodes.EXECUTION_ERROR, describe(e), 0);
        }
    }

    private void completeOwnedSession(CoordinationSession session, ActionResult result) {
        SessionStatus terminal = result.success() ? SessionStatus.COMPLETED : SessionStatus.FAILED;
        String reason = result.error() == null ? null : result.error().code() + ": " + result.error().message();
        if (session.finishIfActive(terminal, reason)) {
            sideChannel.coordinationEnded(session);
        }
    }

    private ActionResult record(ActionRequest request, ActionResult result, long startNanos) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        ActionResult stamped = result.withExecutionTimeMs(elapsed.toMillis());
        sideChannel.actionRecorded(request, stamped, elapsed);
        if (stamped.success()) {
            log.info("Action completed: {} in {}ms", request.actionType(), stamped.metadata().executionTimeMs());
        } else {
            log.warn("Action failed: {} [{}] {}", request.actionType(),
                stamped.error().code(), stamped.error().message());
        }
        return stamped;
    }

    private static Optional<ActionResult> reject(ActionRequest request, String code, String message) {
        return Optional.of(ActionResult.failed(request, code, message, 0));
    }

    // ========== 교차 도메인 워크플로우 ==========

    /**
     * {@inheritDoc}
     *
     * <p>워크플로우 세션은 첫 단계의 도메인을 시작 도메인으로 하여 단계 실행 전에 열리고,
     * 모든 단계가 이 세션에 참여합니다. 워크플로우가 끝나면 반환된 결과가 모두 성공일 때
     * COMPLETED, 아니면 FAILED로 종료됩니다.</p>
     *
     * @throws IllegalStateException {@link #shutdown()} 이후 병렬 실행을 요청한 경우
     */
    @Override
    public List<ActionResult> coordinateCrossOrchestra(List<ActionRequest> requests, boolean parallel) {
        if (requests == null || requests.isEmpty()) {
            return List.of();
        }
        long startNanos = System.nanoTime();
        String orchestrationId = UUID.randomUUID().toString();

        List<ActionRequest> stamped = requests.stream()
            .map(request -> request.withContext(request.context().withOrchestrationId(orchestrationId)))
            .toList();

        log.info("Cross-orchestra coordination started: orchestrationId={}, domains={}, parallel={}",
            orchestrationId, stamped.stream().map(ActionRequest::domain).toList(), parallel);

        ActionRequest first = stamped.get(0);
        CoordinationSession session = CoordinationSession.start(orchestrationId, first.domain(), first.context());
        sessionStore.save(session);
        sideChannel.workflowStarted();
        sideChannel.coordinationStarted(session);

        List<ActionResult> results = null;
        try {
            results = parallel ? runParallel(stamped, session) : runSequential(stamped, session);
            return results;
        } finally {
            completeWorkflow(session, results, parallel, startNanos);
        }
    }

    private List<ActionResult> runSequential(List<ActionRequest> requests, CoordinationSession session) {
        List<ActionResult> results = new ArrayList<>(requests.size());
        for (ActionRequest request : requests) {
            ActionResult result = conduct(request, session);
            results.add(result);
            if (!result.success()) {
                log.warn("Cross-orchestra stopped due to failure in {} ({} of {} steps run)",
                    request.domain(), results.size(), requests.size());
                break;
            }
        }
        return List.copyOf(results);
    }

    private List<ActionResult> runParallel(List<ActionRequest> requests, CoordinationSession session) {
        if (workerPool.isShutdown()) {
            throw new IllegalStateException("Conductor has been shut down");
        }
        List<Future<ActionResult>> futures = new ArrayList<>(requests.size());
        for (ActionRequest request : requests) {
            futures.add(workerPool.submit(() -> conduct(request, session)));
        }

        List<ActionResult> results = new ArrayList<>(requests.size());
        for (int i = 0; i < futures.size(); i++) {
            results.add(awaitStep(futures.get(i), requests.get(i)));
        }
        return List.copyOf(results);
    }

    private static ActionResult awaitStep(Future<ActionResult> future, ActionRequest request) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ActionResult.failed(request, ErrorCodes.EXECUTION_ERROR, "Workflow interrupted", 0);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return ActionResult.failed(request, ErrorCodes.EXECUTION_ERROR, describe(cause), 0);
        }
    }

    private void completeWorkflow(CoordinationSession session, List<ActionResult> results,
                                  boolean parallel, long startNanos) {
        boolean succeeded = results != null && results.stream().allMatch(ActionResult::success);
        String reason = succeeded ? null : firstFailure(results);
        if (session.finishIfActive(succeeded ? SessionStatus.COMPLETED : SessionStatus.FAILED, reason)) {
            sideChannel.coordinationEnded(session);
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        sideChannel.workflowEnded(session, parallel, elapsed);
        log.info("Cross-orchestra coordination finished: orchestrationId={}, status={}, {}ms",
            session.getOrchestrationId(), session.getStatus(), elapsed.toMillis());
    }

    private static String firstFailure(List<ActionResult> results) {
        if (results == null) {
            return "Workflow aborted by an unexpected error";
        }
        return results.stream()
            .filter(result -> !result.success())
            .findFirst()
            .map(result -> result.actionType() + " failed: " + result.error().code())
            .orElse(null);
    }

    // ========== 세션 ==========

    @Override
    public Optional<CoordinationSession> getSession(String orchestrationId) {
        return sessionStore.find(orchestrationId);
    }

    @Override
    public List<CoordinationSession> listActiveSessions() {
        return sessionStore.listActive();
    }

    @Override
    public void clearSessions() {
        sessionStore.clear();
    }

    @Override
    public boolean abortSession(String orchestrationId, String reason) {
        Optional<CoordinationSession> session = sessionStore.find(orchestrationId);
        if (session.isEmpty()) {
            return false;
        }
        if (!session.get().finishIfActive(SessionStatus.ABORTED, reason)) {
            return false;
        }
        log.warn("Coordination session aborted: orchestrationId={}, reason={}", orchestrationId, reason);
        sideChannel.coordinationAborted(session.get());
        return true;
    }

    /**
     * 워커 풀 종료.
     *
     * <p>진행 중인 병렬 단계가 끝날 때까지 최대 60초 대기한 뒤 강제 종료합니다.</p>
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        workerPool.shutdown();
        approvalWaiters.shutdownNow();
        if (!workerPool.awaitTermination(60, TimeUnit.SECONDS)) {
            workerPool.shutdownNow();
        }
    }

    // ========== helpers ==========

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private static String joinIds(List<Domain> domains) {
        return String.join(", ", domains.stream().map(Domain::getId).toList());
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * 승인 대기 실패 (예외, 만료, 타임아웃, 인터럽트).
     */
    private static final class ApprovalWaitException extends Exception {

        ApprovalWaitException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * OrchestraConductor 빌더.
     *
     * <p>registry, authorizer, sessionStore는 필수입니다. 나머지 기본값:</p>
     * <ul>
     *   <li>policyEnforcer: {@link PolicyEnforcer#permitAll()}</li>
     *   <li>riskClassifier: {@link RiskClassifier#lowRisk()}</li>
     *   <li>approvalEngine: 없음 (승인이 필요한 액션은 HITL_FAILED)</li>
     *   <li>sideChannel: {@link SideChannel#noop()}</li>
     *   <li>config: {@link ConductorConfig#ConductorConfig()}</li>
     * </ul>
     */
    public static final class Builder {

        private ManifestRegistry registry;
        private CrossOrchestraAuthorizer authorizer;
        private SessionStore sessionStore;
        private final List<DomainExecutor> executors = new ArrayList<>();
        private PolicyEnforcer policyEnforcer = PolicyEnforcer.permitAll();
        private RiskClassifier riskClassifier = RiskClassifier.lowRisk();
        private ApprovalEngine approvalEngine;
        private SideChannel sideChannel = SideChannel.noop();
        private ConductorConfig config = new ConductorConfig();

        private Builder() {
        }

        public Builder registry(ManifestRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder authorizer(CrossOrchestraAuthorizer authorizer) {
            this.authorizer = authorizer;
            return this;
        }

        public Builder sessionStore(SessionStore sessionStore) {
            this.sessionStore = sessionStore;
            return this;
        }

        public Builder executor(DomainExecutor executor) {
            this.executors.add(executor);
            return this;
        }

        public Builder executors(List<? extends DomainExecutor> executors) {
            this.executors.addAll(executors);
            return this;
        }

        public Builder policyEnforcer(PolicyEnforcer policyEnforcer) {
            this.policyEnforcer = require(policyEnforcer, "policyEnforcer");
            return this;
        }

        public Builder riskClassifier(RiskClassifier riskClassifier) {
            this.riskClassifier = require(riskClassifier, "riskClassifier");
            return this;
        }

        public Builder approvalEngine(ApprovalEngine approvalEngine) {
            this.approvalEngine = approvalEngine;
            return this;
        }

        public Builder sideChannel(SideChannel sideChannel) {
            this.sideChannel = require(sideChannel, "sideChannel");
            return this;
        }

        public Builder config(ConductorConfig config) {
            this.config = require(config, "config");
            return this;
        }

        /**
         * OrchestraConductor 생성.
         *
         * @throws IllegalArgumentException 필수 협력자가 누락된 경우
         */
        public OrchestraConductor build() {
            return new OrchestraConductor(this);
        }

        private static <T> T require(T value, String name) {
            if (value == null) {
                throw new IllegalArgumentException(name + " cannot be null");
            }
            return value;
        }
    }
}
