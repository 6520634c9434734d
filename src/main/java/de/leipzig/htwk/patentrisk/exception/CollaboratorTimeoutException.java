package de.leipzig.htwk.patentrisk.exception;

import lombok.Getter;

/**
 * A collaborator call exceeded its time budget on every attempt, or was cancelled while waiting
 */
@Getter
public class CollaboratorTimeoutException extends EngineException {

    private final String operation;

    public CollaboratorTimeoutException(String operation, String message) {
        super(ErrorKind.TIMEOUT, null, message);
        this.operation = operation;
    }

    public CollaboratorTimeoutException(String operation, String message, Throwable cause) {
        super(ErrorKind.TIMEOUT, null, message, cause);
        this.operation = operation;
    }
}
