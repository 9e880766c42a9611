package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.core.spi.audit.AuditEntry;
import com.ryuqq.conductor.core.spi.audit.AuditSeverity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.Logger;

import java.time.Instant;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

/**
 * LoggingAuditLogger 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class LoggingAuditLoggerTest {

    @Mock
    private Logger auditLog;

    private AuditEntry entry(AuditSeverity severity) {
        return new AuditEntry("tenant-a", "user-a", "orchestra.action.failed",
            "orchestra://finance/actions/post_journal", AuditEntry.CATEGORY, severity,
            Map.of("errorCode", "LEDGER_LOCKED"), Instant.now());
    }

    @Test
    void ERROR_심각도는_error_레벨로_기록() {
        // given
        LoggingAuditLogger logger = new LoggingAuditLogger(auditLog);

        // when
        logger.log(entry(AuditSeverity.ERROR));

        // then
        verify(auditLog).error(anyString(), eq("orchestra.action.failed"),
            eq("orchestra://finance/actions/post_journal"), eq("tenant-a"), eq("user-a"),
            eq("{\"errorCode\":\"LEDGER_LOCKED\"}"));
    }

    @Test
    void WARN_심각도는_warn_레벨로_기록() {
        // given
        LoggingAuditLogger logger = new LoggingAuditLogger(auditLog);

        // when
        logger.log(entry(AuditSeverity.WARN));

        // then
        verify(auditLog).warn(anyString(), eq("orchestra.action.failed"),
            eq("orchestra://finance/actions/post_journal"), eq("tenant-a"), eq("user-a"),
            eq("{\"errorCode\":\"LEDGER_LOCKED\"}"));
    }

    @Test
    void INFO_심각도는_info_레벨로_기록() {
        // given
        LoggingAuditLogger logger = new LoggingAuditLogger(auditLog);

        // when
        logger.log(entry(AuditSeverity.INFO));

        // then
        verify(auditLog).info(anyString(), eq("orchestra.action.failed"),
            eq("orchestra://finance/actions/post_journal"), eq("tenant-a"), eq("user-a"),
            eq("{\"errorCode\":\"LEDGER_LOCKED\"}"));
    }
}
