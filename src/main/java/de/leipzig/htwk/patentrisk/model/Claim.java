package de.leipzig.htwk.patentrisk.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.Builder;
import lombok.Value;

/**
 * A single patent claim. {@code parentClaimNumber} is set iff the claim is dependent.
 */
@Value
@Builder(toBuilder = true)
public class Claim {

    String patentId;
    int claimNumber;
    String text;
    boolean independent;
    Integer parentClaimNumber;

    @Builder.Default
    ClaimType claimType = ClaimType.UNSPECIFIED;

    @Builder.Default
    List<String> keyElements = List.of();

    @JsonIgnore
    double[] embedding;

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }
}
