package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.application.authorization.CrossOrchestraAuthorizer;
import com.ryuqq.conductor.application.registry.ManifestRegistry;
import com.ryuqq.conductor.core.authorization.AuthorizationRequest;
import com.ryuqq.conductor.core.authorization.AuthorizationResult;
import com.ryuqq.conductor.core.authorization.AuthorizationRule;
import com.ryuqq.conductor.core.authorization.AuthorizationTable;
import com.ryuqq.conductor.core.model.Domain;
import com.ryuqq.conductor.core.model.ExecutionContext;
import com.ryuqq.conductor.core.telemetry.SideChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * 정적 규칙 테이블 기반 교차 오케스트라 인가기.
 *
 * <p><strong>검사 순서 (첫 실패에서 중단):</strong></p>
 * <ol>
 *   <li>source 활성 → "Source orchestra not active: &lt;source&gt;"</li>
 *   <li>target 활성 → "Target orchestra not active: &lt;target&gt;"</li>
 *   <li>source 규칙 존재 → "No rules defined for source domain: &lt;source&gt;"</li>
 *   <li>target ∈ canCallDomains → "&lt;source&gt; is not authorized to call &lt;target&gt;"</li>
 *   <li>action ∉ restrictedActions → "Action &lt;action&gt; is restricted for &lt;source&gt;"</li>
 *   <li>컨텍스트 권한 → "Missing required permission: orchestra.&lt;target&gt;.&lt;action&gt;"</li>
 * </ol>
 *
 * <p><strong>컨텍스트 권한 규칙:</strong></p>
 * <ul>
 *   <li>admin 역할은 권한 검사를 통과</li>
 *   <li>permissions가 지정된 경우 요구 권한을 포함해야 함 (null이면 검사 생략)</li>
 *   <li>orchestra.&lt;target&gt; 역할 부재는 WARN 로그만 남김 (차단하지 않음)</li>
 * </ul>
 *
 * <p>모든 결정(허용/거부)은 {@link SideChannel}로 기록됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RuleTableAuthorizer implements CrossOrchestraAuthorizer {

    private static final Logger log = LoggerFactory.getLogger(RuleTableAuthorizer.class);

    static final String ADMIN_ROLE = "admin";

    private final ManifestRegistry registry;
    private final AuthorizationTable table;
    private final SideChannel sideChannel;

    /**
     * 기본 테이블을 사용하는 RuleTableAuthorizer 생성.
     *
     * @param registry 매니페스트 레지스트리
     * @param sideChannel 사이드 채널
     */
    public RuleTableAuthorizer(ManifestRegistry registry, SideChannel sideChannel) {
        this(registry, AuthorizationTable.defaults(), sideChannel);
    }

    /**
     * RuleTableAuthorizer 생성.
     *
     * @param registry 매니페스트 레지스트리
     * @param table 인가 테이블
     * @param sideChannel 사이드 채널
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public RuleTableAuthorizer(ManifestRegistry registry, AuthorizationTable table, SideChannel sideChannel) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (table == null) {
            throw new IllegalArgumentException("table cannot be null");
        }
        if (sideChannel == null) {
            throw new IllegalArgumentException("sideChannel cannot be null");
        }
        this.registry = registry;
        this.table = table;
        this.sideChannel = sideChannel;
    }

    @Override
    public AuthorizationResult authorize(AuthorizationRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        log.debug("Checking cross-orchestra auth: {} -> {} ({})",
            request.sourceDomain(), request.targetDomain(), request.action());

        AuthorizationResult result = evaluate(request);
        if (result.allowed()) {
            log.info("Cross-orchestra auth granted: {} -> {}", request.sourceDomain(), request.targetDomain());
        } else {
            log.warn("Cross-orchestra auth denied: {} -> {}: {}",
                request.sourceDomain(), request.targetDomain(), result.reason());
        }
        sideChannel.authorizationChecked(request, result);
        return result;
    }

    private AuthorizationResult evaluate(AuthorizationRequest request) {
        Domain source = request.sourceDomain();
        Domain target = request.targetDomain();

        if (!registry.isActive(source)) {
            return AuthorizationResult.deny("Source orchestra not active: " + source);
        }
        if (!registry.isActive(target)) {
            return AuthorizationResult.deny("Target orchestra not active: " + target);
        }

        Optional<AuthorizationRule> rule = table.ruleFor(source);
        if (rule.isEmpty()) {
            return AuthorizationResult.deny("No rules defined for source domain: " + source);
        }
        if (!rule.get().canCall(target)) {
            return AuthorizationResult.deny(source + " is not authorized to call " + target);
        }
        if (rule.get().isRestricted(request.action())) {
            return AuthorizationResult.deny("Action " + request.action() + " is restricted for " + source);
        }
        return checkContextPermissions(request);
    }

    private AuthorizationResult checkContextPermissions(AuthorizationRequest request) {
        ExecutionContext context = request.context();
        if (context.hasRole(ADMIN_ROLE)) {
            return AuthorizationResult.allow();
        }

        String required = request.requiredPermission();
        if (context.permissions() != null && !context.permissions().contains(required)) {
            return AuthorizationResult.denyMissingPermission(required);
        }

        String domainRole = "orchestra." + request.targetDomain().getId();
        if (!context.hasRole(domainRole)) {
            log.warn("Caller lacks role {} for {} -> {} (not enforced)",
                domainRole, request.sourceDomain(), request.targetDomain());
        }
        return AuthorizationResult.allow();
    }

    @Override
    public boolean canBeCalled(Domain target, Domain source) {
        return table.canBeCalled(target, source);
    }

    @Override
    public List<Domain> getAllowedTargets(Domain source) {
        return table.allowedTargets(source);
    }

    @Override
    public List<Domain> getAllowedCallers(Domain target) {
        return table.allowedCallers(target);
    }
}
