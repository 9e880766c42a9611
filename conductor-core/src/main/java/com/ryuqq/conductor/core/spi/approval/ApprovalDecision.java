package com.ryuqq.conductor.core.spi.approval;

/**
 * Result of waiting on an approval request.
 *
 * @param requestId the approval request id
 * @param decision the verdict
 * @param approver who decided (nullable, e.g. for expiry)
 * @param reason reason given with the decision (nullable)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ApprovalDecision(
    String requestId,
    ApprovalVerdict decision,
    String approver,
    String reason
) {

    public ApprovalDecision {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId cannot be null or blank");
        }
        if (decision == null) {
            throw new IllegalArgumentException("decision cannot be null");
        }
    }

    public boolean isApproved() {
        return decision == ApprovalVerdict.APPROVED;
    }
}
