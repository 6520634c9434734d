package de.leipzig.htwk.patentrisk.controller;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import com.fasterxml.jackson.core.JsonParseException;

import de.leipzig.htwk.patentrisk.exception.EngineException;
import de.leipzig.htwk.patentrisk.exception.ErrorKind;
import de.leipzig.htwk.patentrisk.exception.RequestValidationException;
import de.leipzig.htwk.patentrisk.exception.RequestValidationException.ValidationError;
import de.leipzig.htwk.patentrisk.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps every failure to a JSON body with {@code success=false}, an {@code error} title and the
 * {@code kind} from the engine's error taxonomy. The HTTP status follows the kind.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationErrors(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
            .collect(Collectors.toMap(
                FieldError::getField,
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (first, second) -> first + "; " + second,
                LinkedHashMap::new));

        Map<String, Object> body = errorBody(ErrorKind.INVALID_INPUT, "Validation failed", "Please fix the following field errors:");
        body.put("fieldErrors", fieldErrors);
        body.put("hint", "Required ids and texts must not be blank, limits must be positive");
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());

        Map<String, Object> body;
        if (ex.getCause() instanceof JsonParseException parseError) {
            body = errorBody(ErrorKind.INVALID_INPUT, "Invalid JSON", "JSON parsing error: " + parseError.getOriginalMessage());
            body.put("hint", "Common issues: trailing commas, missing quotes, unescaped characters");
        } else if (ex.getMessage() != null && ex.getMessage().contains("Cannot deserialize")) {
            body = errorBody(ErrorKind.INVALID_INPUT, "Invalid JSON", "A field has the wrong type");
            body.put("hint", "limit and vectorWeight are numbers, includeExplanation and includeAnalysis are booleans");
        } else {
            body = errorBody(ErrorKind.INVALID_INPUT, "Invalid JSON", "Request body is missing or malformed");
        }
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String expected = ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown";
        Map<String, Object> body = errorBody(ErrorKind.INVALID_INPUT, "Invalid parameter type",
            String.format("Parameter '%s' should be of type %s but received: %s", ex.getName(), expected, ex.getValue()));
        body.put("field", ex.getName());
        body.put("providedValue", ex.getValue());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(RequestValidationException.class)
    public ResponseEntity<Map<String, Object>> handleRequestValidation(RequestValidationException ex) {
        log.warn("Invalid {} request: {}", ex.getRequestType(), ex.getMessage());

        Map<String, Object> body = errorBody(ex.getKind(), "Request validation failed", ex.getMessage());
        body.put("requestType", ex.getRequestType());
        body.put("validationErrors", ex.getValidationErrors().stream()
            .map(GlobalExceptionHandler::describe)
            .toList());
        if (ex.getValidExample() != null) {
            body.put("validExample", ex.getValidExample());
        }
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleFieldValidation(ValidationException ex) {
        log.warn("Invalid value for {}: {}", ex.getField(), ex.getMessage());

        Map<String, Object> body = errorBody(ex.getKind(), "Field validation failed", ex.getMessage());
        body.put("field", ex.getField());
        body.put("providedValue", ex.getProvidedValue());
        putIfPresent(body, "allowedValues", ex.getAllowedValues());
        putIfPresent(body, "suggestion", ex.getSuggestion());
        if (ex.getAdditionalInfo() != null) {
            body.putAll(ex.getAdditionalInfo());
        }
        return ResponseEntity.badRequest().body(body);
    }

    /**
     * Not found, dimension mismatch and collaborator failures that escaped degradation
     */
    @ExceptionHandler(EngineException.class)
    public ResponseEntity<Map<String, Object>> handleEngineError(EngineException ex) {
        HttpStatus status = statusFor(ex.getKind());
        if (status.is5xxServerError()) {
            log.error("{} failure: {}", ex.getKind().getValue(), ex.getMessage());
        } else {
            log.warn("{}: {}", ex.getKind().getValue(), ex.getMessage());
        }

        Map<String, Object> body = errorBody(ex.getKind(), ex.getKind().getValue(), ex.getMessage());
        body.put("recoverable", ex.isRecoverable());
        putIfPresent(body, "field", ex.getField());
        if (ex.isRecoverable()) {
            body.put("hint", "The backing service is unavailable or slow, retry later");
        }
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        String message = ex.getMessage() != null ? ex.getMessage() : "Invalid argument provided";
        return ResponseEntity.badRequest().body(errorBody(ErrorKind.INVALID_INPUT, "Invalid argument", message));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericError(Exception ex) {
        log.error("Unexpected error occurred", ex);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", "Internal server error");
        body.put("message", "An unexpected error occurred");
        body.put("hint", "If this persists, check the server logs");
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case DIMENSION_MISMATCH -> HttpStatus.UNPROCESSABLE_ENTITY;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case EMBEDDING_UNAVAILABLE, EXPLANATION_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    private static Map<String, Object> errorBody(ErrorKind kind, String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", error);
        body.put("kind", kind);
        body.put("message", message);
        return body;
    }

    private static Map<String, Object> describe(ValidationError error) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("field", error.getField());
        entry.put("providedValue", error.getProvidedValue());
        entry.put("message", error.getMessage());
        putIfPresent(entry, "allowedValues", error.getAllowedValues());
        putIfPresent(entry, "suggestion", error.getSuggestion());
        return entry;
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value == null || (value instanceof List<?> list && list.isEmpty())) {
            return;
        }
        map.put(key, value);
    }
}
