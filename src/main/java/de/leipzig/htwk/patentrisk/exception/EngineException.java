package de.leipzig.htwk.patentrisk.exception;

import lombok.Getter;

/**
 * Base class for engine failures carrying the error kind and, where known, the offending field
 */
@Getter
public abstract class EngineException extends RuntimeException {

    private final ErrorKind kind;
    private final String field;

    protected EngineException(ErrorKind kind, String field, String message) {
        super(message);
        this.kind = kind;
        this.field = field;
    }

    protected EngineException(ErrorKind kind, String field, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.field = field;
    }

    public boolean isRecoverable() {
        return kind.isRecoverable();
    }
}
