package de.leipzig.htwk.patentrisk.service.risk;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import de.leipzig.htwk.patentrisk.model.Claim;
import de.leipzig.htwk.patentrisk.model.ClaimMatch;
import de.leipzig.htwk.patentrisk.model.FreedomToOperate;
import de.leipzig.htwk.patentrisk.model.RiskAssessment;
import de.leipzig.htwk.patentrisk.model.RiskLevel;

class RiskAggregatorTest {

    private final RiskAggregator aggregator = new RiskAggregator();

    @Test
    void noMatchesMeansLowRiskAndLikelyFreedom() {
        RiskAssessment assessment = aggregator.aggregate(List.of());

        assertEquals(RiskLevel.LOW, assessment.overallRisk());
        assertEquals(0, assessment.independentClaimsAtRisk());
        assertEquals(0.0, assessment.highestSimilarity());
        assertEquals(FreedomToOperate.LIKELY, assessment.freedomToOperate());
    }

    @Test
    void highRiskIndependentClaimMakesOverallHigh() {
        RiskAssessment assessment = aggregator.aggregate(List.of(
            match(1, true, 0.85, RiskLevel.HIGH),
            match(2, false, 0.65, RiskLevel.MEDIUM)));

        assertEquals(RiskLevel.HIGH, assessment.overallRisk());
        assertEquals(1, assessment.independentClaimsAtRisk());
        assertEquals(0.85, assessment.highestSimilarity());
        assertEquals(0.75, assessment.averageSimilarity(), 1e-12);
        assertEquals(FreedomToOperate.UNLIKELY, assessment.freedomToOperate());
    }

    @Test
    void highRiskOnDependentClaimsOnlyIsMedium() {
        RiskAssessment assessment = aggregator.aggregate(List.of(
            match(2, false, 0.9, RiskLevel.HIGH),
            match(1, true, 0.4, RiskLevel.LOW)));

        assertEquals(RiskLevel.MEDIUM, assessment.overallRisk());
        assertEquals(0, assessment.independentClaimsAtRisk());
        assertEquals(FreedomToOperate.UNCERTAIN, assessment.freedomToOperate());
    }

    @Test
    void onlyLowMatchesStayUncertain() {
        RiskAssessment assessment = aggregator.aggregate(List.of(match(1, true, 0.45, RiskLevel.LOW)));

        assertEquals(RiskLevel.LOW, assessment.overallRisk());
        assertEquals(FreedomToOperate.UNCERTAIN, assessment.freedomToOperate());
    }

    @Test
    void overallIsHighExactlyWhenIndependentClaimsAreAtRisk() {
        List<List<ClaimMatch>> cases = List.of(
            List.of(match(1, true, 0.9, RiskLevel.HIGH)),
            List.of(match(3, false, 0.9, RiskLevel.HIGH)),
            List.of(match(1, true, 0.7, RiskLevel.MEDIUM), match(4, true, 0.81, RiskLevel.HIGH)),
            List.of(match(1, true, 0.3, RiskLevel.LOW)));

        for (List<ClaimMatch> matches : cases) {
            RiskAssessment assessment = aggregator.aggregate(matches);
            assertEquals(assessment.independentClaimsAtRisk() > 0, assessment.overallRisk() == RiskLevel.HIGH);
            assertTrue(assessment.independentClaimsAtRisk() <= matches.size());
        }
    }

    @Test
    void sameIndependentClaimIsCountedOnce() {
        RiskAssessment assessment = aggregator.aggregate(List.of(
            match(1, true, 0.9, RiskLevel.HIGH),
            match(1, true, 0.85, RiskLevel.HIGH)));

        assertEquals(1, assessment.independentClaimsAtRisk());
    }

    @Test
    void defaultTextsFollowTheVerdict() {
        RiskAssessment high = aggregator.aggregate(List.of(match(1, true, 0.9, RiskLevel.HIGH)));

        assertTrue(aggregator.defaultSummary(high, 1).contains("Overall risk: high"));
        assertTrue(aggregator.defaultRecommendation(high).contains("patent attorney"));
        assertEquals("No claims with meaningful similarity were found.", aggregator.defaultSummary(high, 0));
    }

    private ClaimMatch match(int sourceNumber, boolean independent, double similarity, RiskLevel level) {
        return ClaimMatch.builder()
            .sourceClaim(Claim.builder().claimNumber(sourceNumber).text("source").independent(independent).build())
            .targetClaim(Claim.builder().claimNumber(1).text("target").independent(true).build())
            .similarity(similarity)
            .riskLevel(level)
            .build();
    }
}
