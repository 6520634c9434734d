package de.leipzig.htwk.patentrisk.exception;

import com.fasterxml.jackson.annotation.JsonValue;

import lombok.Getter;

/**
 * Error taxonomy of the engine. Recoverable kinds are absorbed into a degraded
 * result; the others fail the single request.
 */
@Getter
public enum ErrorKind {
    INVALID_INPUT("invalid_input", false),
    NOT_FOUND("not_found", false),
    DIMENSION_MISMATCH("dimension_mismatch", false),
    EMBEDDING_UNAVAILABLE("embedding_unavailable", true),
    EXPLANATION_UNAVAILABLE("explanation_unavailable", true),
    TIMEOUT("timeout", true);

    private final String value;
    private final boolean recoverable;

    ErrorKind(String value, boolean recoverable) {
        this.value = value;
        this.recoverable = recoverable;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
