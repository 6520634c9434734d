package de.leipzig.htwk.patentrisk.service.risk;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import de.leipzig.htwk.patentrisk.model.ClaimMatch;
import de.leipzig.htwk.patentrisk.model.FreedomToOperate;
import de.leipzig.htwk.patentrisk.model.RiskAssessment;
import de.leipzig.htwk.patentrisk.model.RiskLevel;

/**
 * Rolls a set of claim matches up into one verdict.
 * <p>
 * Only independent source claims can make the overall risk HIGH: avoiding a dependent claim
 * alone does not avoid its independent parent, so a high-risk dependent match on its own
 * counts as MEDIUM.
 */
@Component
public class RiskAggregator {

    public RiskAssessment aggregate(List<ClaimMatch> matches) {
        if (matches == null || matches.isEmpty()) {
            return new RiskAssessment(RiskLevel.LOW, 0, 0.0, 0.0, FreedomToOperate.LIKELY);
        }

        Set<Integer> independentAtRisk = matches.stream()
            .filter(m -> m.getRiskLevel().isAtLeast(RiskLevel.HIGH))
            .filter(m -> m.getSourceClaim().isIndependent())
            .map(m -> m.getSourceClaim().getClaimNumber())
            .collect(Collectors.toSet());

        RiskLevel overall;
        if (!independentAtRisk.isEmpty()) {
            overall = RiskLevel.HIGH;
        } else if (matches.stream().anyMatch(m -> m.getRiskLevel().isAtLeast(RiskLevel.MEDIUM))) {
            // MEDIUM matches, or HIGH matches on dependent claims only
            overall = RiskLevel.MEDIUM;
        } else {
            overall = RiskLevel.LOW;
        }

        double highest = matches.stream().mapToDouble(ClaimMatch::getSimilarity).max().orElse(0.0);
        double average = matches.stream().mapToDouble(ClaimMatch::getSimilarity).average().orElse(0.0);

        return new RiskAssessment(overall, independentAtRisk.size(), highest, average, freedomToOperate(overall, true));
    }

    static FreedomToOperate freedomToOperate(RiskLevel overall, boolean hasMatches) {
        return switch (overall) {
            case HIGH -> FreedomToOperate.UNLIKELY;
            case MEDIUM -> FreedomToOperate.UNCERTAIN;
            // weak overlap still warrants a look
            case LOW -> hasMatches ? FreedomToOperate.UNCERTAIN : FreedomToOperate.LIKELY;
        };
    }

    /**
     * Summary used when no explanation service contributed one
     */
    public String defaultSummary(RiskAssessment assessment, int matchCount) {
        if (matchCount == 0) {
            return "No claims with meaningful similarity were found.";
        }
        return String.format("%d matching claim pair(s) found; highest similarity %.2f, %d independent claim(s) at high risk. Overall risk: %s.",
            matchCount, assessment.highestSimilarity(), assessment.independentClaimsAtRisk(),
            assessment.overallRisk().getValue());
    }

    public String defaultRecommendation(RiskAssessment assessment) {
        return switch (assessment.freedomToOperate()) {
            case UNLIKELY -> "Independent claims overlap substantially. Consult a patent attorney before proceeding and review design-around options.";
            case UNCERTAIN -> "Some claims overlap. Review the matched claims in detail with a patent professional.";
            case LIKELY -> "No significant claim overlap detected.";
        };
    }
}
