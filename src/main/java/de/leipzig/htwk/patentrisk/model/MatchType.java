package de.leipzig.htwk.patentrisk.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which retrieval leg surfaced a search candidate
 */
public enum MatchType {
    VECTOR("vector"),
    FUZZY("fuzzy"),
    HYBRID("hybrid");

    private final String value;

    MatchType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
