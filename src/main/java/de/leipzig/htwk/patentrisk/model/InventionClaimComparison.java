package de.leipzig.htwk.patentrisk.model;

import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * An invention description scored against every claim of one patent, most similar claim first.
 * The invention is the source claim of each match.
 */
@Value
@Builder
public class InventionClaimComparison {

    Patent patent;
    int totalClaims;
    int highRiskClaims;
    List<ClaimMatch> claimComparisons;
    boolean degraded;
}
