package de.leipzig.htwk.patentrisk.exception;

public class ExplanationUnavailableException extends EngineException {

    public ExplanationUnavailableException(String message) {
        super(ErrorKind.EXPLANATION_UNAVAILABLE, null, message);
    }

    public ExplanationUnavailableException(String message, Throwable cause) {
        super(ErrorKind.EXPLANATION_UNAVAILABLE, null, message, cause);
    }
}
