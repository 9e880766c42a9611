package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.core.json.JsonSupport;
import com.ryuqq.conductor.core.spi.audit.AuditEntry;
import com.ryuqq.conductor.core.spi.audit.AuditLogger;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 감사 항목을 전용 SLF4J 로거("orchestra.audit")로 기록하는 {@link AuditLogger}.
 *
 * <p>로그 백엔드 설정으로 감사 로그만 별도 파일/싱크로 분리할 수 있습니다.
 * 심각도는 로그 레벨로 매핑됩니다 (INFO → info, WARN → warn, ERROR → error).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class LoggingAuditLogger implements AuditLogger {

    public static final String LOGGER_NAME = "orchestra.audit";

    private final Logger auditLog;

    public LoggingAuditLogger() {
        this(LoggerFactory.getLogger(LOGGER_NAME));
    }

    LoggingAuditLogger(Logger auditLog) {
        this.auditLog = auditLog;
    }

    @Override
    public void log(AuditEntry entry) {
        String details = renderDetails(entry);
        switch (entry.severity()) {
            case ERROR -> auditLog.error("{} {} tenant={} subject={} details={}",
                entry.action(), entry.resource(), entry.tenantId(), entry.subject(), details);
            case WARN -> auditLog.warn("{} {} tenant={} subject={} details={}",
                entry.action(), entry.resource(), entry.tenantId(), entry.subject(), details);
            default -> auditLog.info("{} {} tenant={} subject={} details={}",
                entry.action(), entry.resource(), entry.tenantId(), entry.subject(), details);
        }
    }

    private static String renderDetails(AuditEntry entry) {
        try {
            return JsonSupport.mapper().writeValueAsString(entry.details());
        } catch (JsonProcessingException e) {
            return String.valueOf(entry.details());
        }
    }
}
