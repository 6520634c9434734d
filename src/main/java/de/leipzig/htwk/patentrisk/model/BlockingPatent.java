package de.leipzig.htwk.patentrisk.model;

import java.util.List;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BlockingPatent {

    Patent patent;
    List<ClaimMatch> blockingClaims;
    double highestSimilarity;
    RiskLevel overallRisk;
}
