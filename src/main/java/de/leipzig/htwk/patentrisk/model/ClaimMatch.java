package de.leipzig.htwk.patentrisk.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

@Value
@Builder(toBuilder = true)
public class ClaimMatch {

    Claim sourceClaim;
    Claim targetClaim;
    double similarity;
    RiskLevel riskLevel;

    @With
    String overlapAssessment;

    // Scored without a vector on at least one side
    boolean degraded;
}
