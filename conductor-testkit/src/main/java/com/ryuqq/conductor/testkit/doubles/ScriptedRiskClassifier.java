package com.ryuqq.conductor.testkit.doubles;

import com.ryuqq.conductor.core.model.ExecutionContext;
import com.ryuqq.conductor.core.spi.approval.RiskClassifier;
import com.ryuqq.conductor.core.spi.approval.RiskLevel;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link RiskClassifier} returning scripted levels per action type, LOW otherwise.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ScriptedRiskClassifier implements RiskClassifier {

    private final Map<String, RiskLevel> levels = new ConcurrentHashMap<>();

    /**
     * Scripts a level.
     *
     * @param actionType {@code <domain>.<action>}
     * @param level the level to return
     * @return this classifier
     */
    public ScriptedRiskClassifier classify(String actionType, RiskLevel level) {
        levels.put(actionType, level);
        return this;
    }

    @Override
    public RiskLevel classify(String actionType, ExecutionContext context) {
        return levels.getOrDefault(actionType, RiskLevel.LOW);
    }
}
