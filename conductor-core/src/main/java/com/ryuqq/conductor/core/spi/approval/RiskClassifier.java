package com.ryuqq.conductor.core.spi.approval;

import com.ryuqq.conductor.core.model.ExecutionContext;

/**
 * Human-in-the-loop risk classification SPI.
 *
 * <p>Action types are rendered as {@code <domain>.<action>}, e.g. {@code finance.generate_invoice}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RiskClassifier {

    /**
     * Classifies an action type.
     *
     * @param actionType {@code <domain>.<action>}
     * @param context the execution context
     * @return the risk level, never null
     */
    RiskLevel classify(String actionType, ExecutionContext context);

    /**
     * Whether a level requires human approval. Everything above LOW does by default.
     *
     * @param level the risk level
     * @return true if an approval must be requested
     */
    default boolean requiresApproval(RiskLevel level) {
        return level != RiskLevel.LOW;
    }

    /**
     * Classifier that rates every action LOW.
     *
     * @return a classifier that never requires approval
     */
    static RiskClassifier lowRisk() {
        return (actionType, context) -> RiskLevel.LOW;
    }
}
