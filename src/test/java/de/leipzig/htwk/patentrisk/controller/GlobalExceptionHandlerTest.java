package de.leipzig.htwk.patentrisk.controller;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import de.leipzig.htwk.patentrisk.exception.CollaboratorTimeoutException;
import de.leipzig.htwk.patentrisk.exception.EmbeddingUnavailableException;
import de.leipzig.htwk.patentrisk.exception.ErrorKind;
import de.leipzig.htwk.patentrisk.exception.PatentNotFoundException;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void everyKindMapsToAStatus() {
        assertEquals(HttpStatus.BAD_REQUEST, GlobalExceptionHandler.statusFor(ErrorKind.INVALID_INPUT));
        assertEquals(HttpStatus.NOT_FOUND, GlobalExceptionHandler.statusFor(ErrorKind.NOT_FOUND));
        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, GlobalExceptionHandler.statusFor(ErrorKind.DIMENSION_MISMATCH));
        assertEquals(HttpStatus.GATEWAY_TIMEOUT, GlobalExceptionHandler.statusFor(ErrorKind.TIMEOUT));
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, GlobalExceptionHandler.statusFor(ErrorKind.EMBEDDING_UNAVAILABLE));
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, GlobalExceptionHandler.statusFor(ErrorKind.EXPLANATION_UNAVAILABLE));
    }

    @Test
    void notFoundCarriesTheOffendingField() {
        ResponseEntity<Map<String, Object>> response = handler.handleEngineError(new PatentNotFoundException("sourcePatentId", "X-1"));

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        Map<String, Object> body = response.getBody();
        assertEquals(false, body.get("success"));
        assertEquals(ErrorKind.NOT_FOUND, body.get("kind"));
        assertEquals("sourcePatentId", body.get("field"));
        assertEquals(false, body.get("recoverable"));
        assertFalse(body.containsKey("hint"));
    }

    @Test
    void recoverableFailuresGetARetryHint() {
        ResponseEntity<Map<String, Object>> response = handler.handleEngineError(
            new EmbeddingUnavailableException("Embedding service request failed: connection refused"));

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        assertEquals("embedding_unavailable", response.getBody().get("error"));
        assertTrue(response.getBody().containsKey("hint"));
    }

    @Test
    void timeoutIsAGatewayTimeout() {
        ResponseEntity<Map<String, Object>> response = handler.handleEngineError(
            new CollaboratorTimeoutException("compare claims", "compare claims did not finish within 10 ms"));

        assertEquals(HttpStatus.GATEWAY_TIMEOUT, response.getStatusCode());
        assertEquals(ErrorKind.TIMEOUT, response.getBody().get("kind"));
    }

    @Test
    void illegalArgumentIsABadRequest() {
        ResponseEntity<Map<String, Object>> response = handler.handleIllegalArgument(new IllegalArgumentException());

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("Invalid argument provided", response.getBody().get("message"));
    }
}
