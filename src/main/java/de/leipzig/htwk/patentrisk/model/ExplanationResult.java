package de.leipzig.htwk.patentrisk.model;

import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * Prose produced by the explanation service. Advisory only, never feeds the numeric risk path.
 */
@Value
@Builder
public class ExplanationResult {

    FreedomToOperate freedomToOperate;
    String summary;

    @Builder.Default
    List<String> keyRisks = List.of();

    @Builder.Default
    List<String> designAroundSuggestions = List.of();

    String recommendation;

    // One entry per match handed to the service, in the same order
    @Builder.Default
    List<String> matchAssessments = List.of();
}
