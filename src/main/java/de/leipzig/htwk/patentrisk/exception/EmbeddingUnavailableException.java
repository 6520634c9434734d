package de.leipzig.htwk.patentrisk.exception;

public class EmbeddingUnavailableException extends EngineException {

    public EmbeddingUnavailableException(String message) {
        super(ErrorKind.EMBEDDING_UNAVAILABLE, null, message);
    }

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(ErrorKind.EMBEDDING_UNAVAILABLE, null, message, cause);
    }
}
