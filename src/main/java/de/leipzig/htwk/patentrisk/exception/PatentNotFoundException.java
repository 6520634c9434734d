package de.leipzig.htwk.patentrisk.exception;

import lombok.Getter;

@Getter
public class PatentNotFoundException extends EngineException {

    private final String patentId;

    public PatentNotFoundException(String field, String patentId) {
        super(ErrorKind.NOT_FOUND, field, String.format("Patent '%s' not found", patentId));
        this.patentId = patentId;
    }
}
