package com.ryuqq.conductor.core.spi.approval;

/**
 * Final decision on an approval request.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ApprovalVerdict {
    APPROVED,
    REJECTED,
    EXPIRED,
    CANCELLED
}
