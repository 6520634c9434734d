package de.leipzig.htwk.patentrisk.exception;

import lombok.Getter;

/**
 * Two embeddings that should be comparable have different lengths. This points at a
 * data-integrity problem upstream (model switched without re-embedding the corpus).
 */
@Getter
public class DimensionMismatchException extends EngineException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(String field, int expected, int actual) {
        super(ErrorKind.DIMENSION_MISMATCH, field,
            String.format("Embedding dimension mismatch: expected %d but got %d", expected, actual));
        this.expected = expected;
        this.actual = actual;
    }
}
