package de.leipzig.htwk.patentrisk.model;

import java.time.LocalDate;
import java.time.LocalDateTime;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.Builder;
import lombok.Value;

/**
 * Patent as handed over by the catalog. Read-only for the engine.
 */
@Value
@Builder(toBuilder = true)
public class Patent {

    String id;
    String title;
    String abstractText;
    String claimsText;
    String patentNumber;
    String applicant;
    String classification;
    LocalDate filingDate;
    LocalDate publicationDate;
    LocalDateTime createdAt;

    @JsonIgnore
    double[] embedding;

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }

    /**
     * Title and abstract, the text that lexical matching runs against
     */
    public String searchableText() {
        String t = title != null ? title : "";
        String a = abstractText != null ? abstractText : "";
        return (t + " " + a).trim();
    }
}
