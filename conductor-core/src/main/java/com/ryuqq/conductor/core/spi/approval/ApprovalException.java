package com.ryuqq.conductor.core.spi.approval;

/**
 * Raised by an approval engine when a request cannot be decided: it expired, was
 * cancelled, or the engine itself failed.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ApprovalException extends RuntimeException {

    private final String requestId;

    public ApprovalException(String requestId, String message) {
        super(message);
        this.requestId = requestId;
    }

    public ApprovalException(String requestId, String message, Throwable cause) {
        super(message, cause);
        this.requestId = requestId;
    }

    /**
     * The approval request id, may be null if the request was never created.
     */
    public String getRequestId() {
        return requestId;
    }
}
