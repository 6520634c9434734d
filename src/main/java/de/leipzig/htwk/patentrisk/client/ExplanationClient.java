package de.leipzig.htwk.patentrisk.client;

import java.util.List;

import de.leipzig.htwk.patentrisk.model.BlockingPatent;
import de.leipzig.htwk.patentrisk.model.ClaimMatch;
import de.leipzig.htwk.patentrisk.model.ExplanationResult;
import de.leipzig.htwk.patentrisk.model.Patent;

/**
 * Generative explanation of a risk assessment. Optional: callers must produce a complete
 * numeric result without it.
 */
public interface ExplanationClient {

    /**
     * @param matches the claim matches to comment on, may be empty for a document-level comparison
     */
    ExplanationResult explainComparison(Patent source, Patent target, List<ClaimMatch> matches);

    ExplanationResult explainPriorArt(String inventionDescription, List<BlockingPatent> blockingPatents);

    boolean isEnabled();
}
