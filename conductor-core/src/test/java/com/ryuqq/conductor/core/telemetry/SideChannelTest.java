package com.ryuqq.conductor.core.telemetry;

import com.ryuqq.conductor.core.authorization.AuthorizationRequest;
import com.ryuqq.conductor.core.authorization.AuthorizationResult;
import com.ryuqq.conductor.core.model.ActionRequest;
import com.ryuqq.conductor.core.model.ActionResult;
import com.ryuqq.conductor.core.model.Arguments;
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
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SideChannel 테스트.
 *
 * <ul>
 *   <li>감사/이벤트/메트릭 실패는 호출자에게 전파되지 않음</li>
 *   <li>결정마다 올바른 감사 액션과 이벤트 타입 기록</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class SideChannelTest {

    private final List<AuditEntry> audits = new ArrayList<>();
    private final List<OrchestraEvent> events = new ArrayList<>();
    private final List<String> counters = new ArrayList<>();

    private final MetricsSink countingSink = new MetricsSink() {
        @Override
        public void increment(String name, Map<String, String> tags) {
            counters.add(name);
        }

        @Override
        public void setGauge(String name, Map<String, String> tags, double value) {
        }

        @Override
        public void adjustGauge(String name, Map<String, String> tags, double delta) {
        }

        @Override
        public void recordDuration(String name, Map<String, String> tags, Duration duration) {
        }
    };

    private final SideChannel sideChannel = new SideChannel(audits::add, events::add, countingSink);

    private final ExecutionContext context = ExecutionContext.of("tenant-1").withUserId("user-1").withOrchestrationId("orc-1");

    @Test
    void constructor_NullCollaborator_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> new SideChannel(null, EventEmitter.noop(), MetricsSink.noop()));
    }

    @Test
    void audit_LoggerThrows_IsSwallowed() {
        // Given
        AuditLogger failing = entry -> {
            throw new IllegalStateException("audit store down");
        };
        SideChannel channel = new SideChannel(failing, EventEmitter.noop(), MetricsSink.noop());

        // When & Then
        assertDoesNotThrow(() -> channel.actionRecorded(request(), ActionResult.failed(request(), "X", "boom", 1),
            Duration.ofMillis(1)));
    }

    @Test
    void publish_EmitterThrows_IsSwallowed() {
        // Given
        EventEmitter failing = event -> {
            throw new IllegalStateException("bus down");
        };
        SideChannel channel = new SideChannel(AuditLogger.noop(), failing, MetricsSink.noop());

        // When & Then
        assertDoesNotThrow(() -> channel.coordinationStarted(
            CoordinationSession.start("orc-1", Domain.DATABASE, context)));
    }

    @Test
    void increment_SinkThrows_IsSwallowed() {
        // Given
        MetricsSink failing = new MetricsSink() {
            @Override
            public void increment(String name, Map<String, String> tags) {
                throw new IllegalStateException("registry closed");
            }

            @Override
            public void setGauge(String name, Map<String, String> tags, double value) {
                throw new IllegalStateException("registry closed");
            }

            @Override
            public void adjustGauge(String name, Map<String, String> tags, double delta) {
                throw new IllegalStateException("registry closed");
            }

            @Override
            public void recordDuration(String name, Map<String, String> tags, Duration duration) {
                throw new IllegalStateException("registry closed");
            }
        };
        SideChannel channel = new SideChannel(AuditLogger.noop(), EventEmitter.noop(), failing);

        // When & Then
        assertDoesNotThrow(() -> channel.activeOrchestras(3));
        assertDoesNotThrow(() -> channel.workflowStarted());
    }

    @Test
    void actionRecorded_Failure_AuditsErrorAndCountsErrorCode() {
        // When
        sideChannel.actionRecorded(request(), ActionResult.failed(request(), "POLICY_DENIED", "blocked", 2),
            Duration.ofMillis(2));

        // Then
        assertEquals(1, audits.size());
        assertEquals("orchestra.action.failed", audits.get(0).action());
        assertEquals(AuditSeverity.ERROR, audits.get(0).severity());
        assertEquals("orchestra://finance/actions/generate_invoice", audits.get(0).resource());
        assertEquals("user-1", audits.get(0).subject());
        assertEquals(OrchestraEventType.ACTION_FAILED, events.get(0).type());
        assertEquals(List.of(MetricNames.ACTIONS, MetricNames.ERRORS), counters);
    }

    @Test
    void authorizationChecked_Denial_AuditsWarning() {
        // Given
        AuthorizationRequest request = new AuthorizationRequest(Domain.DEVEX, Domain.FINANCE, "read", context);

        // When
        sideChannel.authorizationChecked(request, AuthorizationResult.deny("devex is not authorized to call finance"));

        // Then
        assertEquals("orchestra.cross_auth.denied", audits.get(0).action());
        assertEquals(AuditSeverity.WARN, audits.get(0).severity());
        assertEquals("orchestra://devex/cross-auth/finance", audits.get(0).resource());
        assertEquals(OrchestraEventType.CROSS_AUTH_CHECKED, events.get(0).type());
        assertEquals(List.of(MetricNames.CROSS_AUTH_CHECKS), counters);
    }

    @Test
    void coordinationEnded_FailedSession_AuditsFailure() {
        // Given
        CoordinationSession session = CoordinationSession.start("orc-1", Domain.BFF_API, context);
        session.involve(Domain.DATABASE);
        session.finish(SessionStatus.FAILED, "boom");

        // When
        sideChannel.coordinationEnded(session);

        // Then
        assertEquals("orchestra.coordination.failed", audits.get(0).action());
        assertEquals("orchestra://coordination/orc-1", audits.get(0).resource());
        assertEquals(List.of("database", "bff-api"), audits.get(0).details().get("involvedDomains"));
        assertEquals("failed", audits.get(0).details().get("status"));
    }

    private ActionRequest request() {
        return ActionRequest.of(Domain.FINANCE, "generate_invoice", Arguments.empty(), context);
    }
}
