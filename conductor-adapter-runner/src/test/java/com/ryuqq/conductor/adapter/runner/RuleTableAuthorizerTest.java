package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.adapter.inmemory.telemetry.InMemoryAuditLogger;
import com.ryuqq.conductor.application.registry.ManifestRegistry;
import com.ryuqq.conductor.core.authorization.AuthorizationRequest;
import com.ryuqq.conductor.core.authorization.AuthorizationResult;
import com.ryuqq.conductor.core.authorization.AuthorizationRule;
import com.ryuqq.conductor.core.authorization.AuthorizationTable;
import com.ryuqq.conductor.core.model.Domain;
import com.ryuqq.conductor.core.model.ExecutionContext;
import com.ryuqq.conductor.core.spi.audit.AuditEntry;
import com.ryuqq.conductor.core.spi.event.EventEmitter;
import com.ryuqq.conductor.core.spi.metrics.MetricsSink;
import com.ryuqq.conductor.core.telemetry.SideChannel;
import com.ryuqq.conductor.testkit.fixture.Requests;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

/**
 * RuleTableAuthorizer 테스트.
 *
 * <p>검사 순서(활성 → 규칙 → 방향 → 제한 액션 → 컨텍스트 권한)와 모든 결정의 감사 기록을 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class RuleTableAuthorizerTest {

    @Mock
    private ManifestRegistry registry;

    private InMemoryAuditLogger auditLogger;
    private RuleTableAuthorizer authorizer;

    @BeforeEach
    void setUp() {
        auditLogger = new InMemoryAuditLogger();
        SideChannel sideChannel = new SideChannel(auditLogger, EventEmitter.noop(), MetricsSink.noop());
        authorizer = new RuleTableAuthorizer(registry, sideChannel);
    }

    private void activate(Domain... domains) {
        for (Domain domain : domains) {
            when(registry.isActive(domain)).thenReturn(true);
        }
    }

    private AuthorizationRequest request(Domain source, Domain target, String action, ExecutionContext context) {
        return new AuthorizationRequest(source, target, action, context);
    }

    @Test
    void 소스_오케스트라가_비활성이면_거부() {
        // given
        when(registry.isActive(Domain.BFF_API)).thenReturn(false);

        // when
        AuthorizationResult result = authorizer.authorize(
            request(Domain.BFF_API, Domain.DATABASE, "read", Requests.context()));

        // then
        assertThat(result.allowed()).isFalse();
        assertThat(result.reason()).isEqualTo("Source orchestra not active: bff-api");
        verify(registry).isActive(Domain.BFF_API);
        verifyNoMoreInteractions(registry);
    }

    @Test
    void 타겟_오케스트라가_비활성이면_거부() {
        // given
        activate(Domain.BFF_API);
        when(registry.isActive(Domain.DATABASE)).thenReturn(false);

        // when
        AuthorizationResult result = authorizer.authorize(
            request(Domain.BFF_API, Domain.DATABASE, "read", Requests.context()));

        // then
        assertThat(result.reason()).isEqualTo("Target orchestra not active: database");
    }

    @Test
    void 소스_규칙이_없으면_거부() {
        // given
        activate(Domain.FINANCE, Domain.DATABASE);
        AuthorizationTable table = AuthorizationTable.builder()
            .rule(Domain.DATABASE, AuthorizationRule.of(Set.of(), Set.of()))
            .build();
        RuleTableAuthorizer custom = new RuleTableAuthorizer(registry, table, SideChannel.noop());

        // when
        AuthorizationResult result = custom.authorize(
            request(Domain.FINANCE, Domain.DATABASE, "read", Requests.context()));

        // then
        assertThat(result.reason()).isEqualTo("No rules defined for source domain: finance");
    }

    @Test
    void 호출_방향이_허용되지_않으면_거부() {
        // given
        activate(Domain.DATABASE, Domain.BFF_API);

        // when
        AuthorizationResult result = authorizer.authorize(
            request(Domain.DATABASE, Domain.BFF_API, "read", Requests.context()));

        // then
        assertThat(result.allowed()).isFalse();
        assertThat(result.reason()).isEqualTo("database is not authorized to call bff-api");
    }

    @Test
    void 허용된_방향의_역방향은_별도로_거부() {
        // given
        activate(Domain.BFF_API, Domain.DATABASE);

        // when
        AuthorizationResult forward = authorizer.authorize(
            request(Domain.BFF_API, Domain.DATABASE, "read", Requests.context()));
        AuthorizationResult backward = authorizer.authorize(
            request(Domain.DATABASE, Domain.BFF_API, "read", Requests.context()));

        // then
        assertThat(forward.allowed()).isTrue();
        assertThat(backward.allowed()).isFalse();
    }

    @Test
    void 제한된_액션은_허용된_방향이어도_거부() {
        // given
        activate(Domain.FINANCE, Domain.DATABASE);

        // when
        AuthorizationResult result = authorizer.authorize(
            request(Domain.FINANCE, Domain.DATABASE, "create", Requests.context()));

        // then
        assertThat(result.reason()).isEqualTo("Action create is restricted for finance");
    }

    @Test
    void 권한_목록에_요구_권한이_없으면_거부() {
        // given
        activate(Domain.BFF_API, Domain.DATABASE);
        ExecutionContext context = Requests.context().withPermissions(List.of("orchestra.database.write"));

        // when
        AuthorizationResult result = authorizer.authorize(
            request(Domain.BFF_API, Domain.DATABASE, "read", context));

        // then
        assertThat(result.allowed()).isFalse();
        assertThat(result.reason()).isEqualTo("Missing required permission: orchestra.database.read");
        assertThat(result.requiredPermissions()).containsExactly("orchestra.database.read");
    }

    @Test
    void 빈_권한_목록은_미지정과_달리_거부() {
        // given
        activate(Domain.BFF_API, Domain.DATABASE);

        // when
        AuthorizationResult empty = authorizer.authorize(
            request(Domain.BFF_API, Domain.DATABASE, "read", Requests.context().withPermissions(List.of())));
        AuthorizationResult absent = authorizer.authorize(
            request(Domain.BFF_API, Domain.DATABASE, "read", Requests.context()));

        // then
        assertThat(empty.allowed()).isFalse();
        assertThat(absent.allowed()).isTrue();
    }

    @Test
    void 요구_권한이_있으면_허용() {
        // given
        activate(Domain.BFF_API, Domain.DATABASE);
        ExecutionContext context = Requests.context().withPermissions(List.of("orchestra.database.read"));

        // when
        AuthorizationResult result = authorizer.authorize(
            request(Domain.BFF_API, Domain.DATABASE, "read", context));

        // then
        assertThat(result.allowed()).isTrue();
        assertThat(result.reason()).isNull();
    }

    @Test
    void admin_역할은_권한_검사를_통과() {
        // given
        activate(Domain.BFF_API, Domain.DATABASE);
        ExecutionContext context = Requests.context()
            .withPermissions(List.of())
            .withRoles(List.of("admin"));

        // when
        AuthorizationResult result = authorizer.authorize(
            request(Domain.BFF_API, Domain.DATABASE, "read", context));

        // then
        assertThat(result.allowed()).isTrue();
    }

    @Test
    void admin_역할도_호출_방향_규칙은_우회하지_못함() {
        // given
        activate(Domain.DEVEX, Domain.FINANCE);
        ExecutionContext context = Requests.context().withRoles(List.of("admin"));

        // when
        AuthorizationResult result = authorizer.authorize(
            request(Domain.DEVEX, Domain.FINANCE, "read", context));

        // then
        assertThat(result.allowed()).isFalse();
    }

    @Test
    void 허용과_거부_모두_감사_기록() {
        // given
        activate(Domain.BFF_API, Domain.DATABASE);

        // when
        authorizer.authorize(request(Domain.BFF_API, Domain.DATABASE, "read", Requests.context()));
        authorizer.authorize(request(Domain.DATABASE, Domain.BFF_API, "read", Requests.context()));

        // then
        List<AuditEntry> granted = auditLogger.entriesFor("orchestra.cross_auth.granted");
        List<AuditEntry> denied = auditLogger.entriesFor("orchestra.cross_auth.denied");
        assertThat(granted).hasSize(1);
        assertThat(denied).hasSize(1);
        assertThat(granted.get(0).tenantId()).isEqualTo(Requests.TENANT);
        assertThat(denied.get(0).resource()).isEqualTo("orchestra://database/cross-auth/bff-api");
    }

    @Test
    void 조회_메서드는_규칙_테이블을_따름() {
        assertThat(authorizer.canBeCalled(Domain.DATABASE, Domain.COMPLIANCE)).isTrue();
        assertThat(authorizer.canBeCalled(Domain.COMPLIANCE, Domain.DATABASE)).isFalse();
        assertThat(authorizer.getAllowedTargets(Domain.DEVEX))
            .containsExactly(Domain.BACKEND_INFRA, Domain.OBSERVABILITY);
        assertThat(authorizer.getAllowedCallers(Domain.OBSERVABILITY))
            .containsExactly(Domain.BACKEND_INFRA, Domain.COMPLIANCE, Domain.DEVEX);
    }

    @Test
    void null_요청은_예외() {
        assertThatThrownBy(() -> authorizer.authorize(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
