package de.leipzig.htwk.patentrisk.service.risk;

import org.springframework.stereotype.Component;

import de.leipzig.htwk.patentrisk.config.RiskEngineConfig;
import de.leipzig.htwk.patentrisk.model.RiskLevel;
import lombok.RequiredArgsConstructor;

/**
 * Per-match risk level from similarity alone
 */
@Component
@RequiredArgsConstructor
public class RiskClassifier {

    private final RiskEngineConfig config;

    public RiskLevel classify(double similarity) {
        if (similarity >= config.getHighRiskThreshold()) {
            return RiskLevel.HIGH;
        }
        if (similarity >= config.getMediumRiskThreshold()) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }
}
