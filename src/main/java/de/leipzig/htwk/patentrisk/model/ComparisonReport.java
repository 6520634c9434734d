package de.leipzig.htwk.patentrisk.model;

import java.util.List;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ComparisonReport {

    String sourcePatentId;
    String targetPatentId;

    @Builder.Default
    List<ClaimMatch> topMatches = List.of();

    RiskLevel overallRisk;
    int independentClaimsAtRisk;
    double highestSimilarity;
    double averageSimilarity;
    FreedomToOperate freedomToOperate;

    int sourceClaimsCount;
    int targetClaimsCount;

    // Whole-document score, only set for patent-level comparisons
    HybridScore documentScore;

    String summary;
    String recommendation;

    @Builder.Default
    List<String> keyRisks = List.of();

    @Builder.Default
    List<String> designAroundSuggestions = List.of();

    boolean explained;
    boolean degraded;
}
