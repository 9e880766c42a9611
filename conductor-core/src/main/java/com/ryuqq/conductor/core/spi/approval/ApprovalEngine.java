package com.ryuqq.conductor.core.spi.approval;

/**
 * Human-in-the-loop approval engine SPI.
 *
 * <p><strong>Request ids:</strong> an id starting with the auto-approval prefix
 * (default {@code auto-approved-}) means the engine approved the request immediately and the
 * caller must not wait. Any other id refers to a pending request.</p>
 *
 * <p><strong>Blocking:</strong> {@link #waitForApproval(String)} blocks until an operator decides
 * or the engine's own expiry elapses. Expiry and timeout policy belong to the engine.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ApprovalEngine {

    /**
     * Submits an approval request.
     *
     * @param request the request details
     * @return the request id (auto-approval ids carry the distinguished prefix)
     * @throws ApprovalException if the request cannot be submitted
     */
    String requestApproval(ApprovalRequest request);

    /**
     * Blocks until the request is decided.
     *
     * @param requestId the pending request id
     * @return the decision
     * @throws ApprovalException on expiry, cancellation or engine failure
     */
    ApprovalDecision waitForApproval(String requestId);
}
