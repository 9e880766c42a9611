package com.ryuqq.conductor.core.spi.approval;

import java.util.List;
import java.util.Map;

/**
 * Approval request submitted to the approval engine for a high-risk action.
 *
 * @param actionType {@code <domain>.<action>}
 * @param requester user id, else tenant id, else "system"
 * @param tenantId tenant id
 * @param description human readable description
 * @param affectedResources resource URNs, e.g. {@code orchestra://finance/generate_invoice}
 * @param riskLevel the classified risk level
 * @param context full context (orchestration id, domain, action, arguments)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ApprovalRequest(
    String actionType,
    String requester,
    String tenantId,
    String description,
    List<String> affectedResources,
    RiskLevel riskLevel,
    Map<String, Object> context
) {

    public ApprovalRequest {
        if (actionType == null || actionType.isBlank()) {
            throw new IllegalArgumentException("actionType cannot be null or blank");
        }
        if (requester == null || requester.isBlank()) {
            throw new IllegalArgumentException("requester cannot be null or blank");
        }
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId cannot be null or blank");
        }
        if (riskLevel == null) {
            throw new IllegalArgumentException("riskLevel cannot be null");
        }
        affectedResources = affectedResources == null ? List.of() : List.copyOf(affectedResources);
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
