package de.leipzig.htwk.patentrisk.model;

import java.util.List;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PriorArtReport {

    String querySummary;
    long patentsSearched;
    List<BlockingPatent> blockingPatents;

    // Absent when not requested or when the explanation service was unavailable
    ExplanationResult analysis;

    boolean degraded;
}
