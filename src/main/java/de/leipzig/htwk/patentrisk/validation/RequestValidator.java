package de.leipzig.htwk.patentrisk.validation;

import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import de.leipzig.htwk.patentrisk.exception.RequestValidationException;
import de.leipzig.htwk.patentrisk.exception.RequestValidationException.ValidationError;
import de.leipzig.htwk.patentrisk.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;

/**
 * Domain rules on request parameters that bean validation cannot express
 */
@Component
@Slf4j
public class RequestValidator {

    /**
     * Validate required string field
     */
    public static void validateRequired(Object value, String fieldName, String purpose) {
        if (value == null || (value instanceof String str && str.trim().isEmpty())) {
            throw new RequestValidationException("required field validation", List.of(
                new ValidationError(
                    fieldName,
                    value,
                    String.format("%s is required %s", fieldName, purpose),
                    null,
                    String.format("Provide a valid %s value", fieldName)
                )
            ));
        }
    }

    /**
     * Validate a result limit. Null means "use the default" and passes.
     */
    public static void validateLimit(Integer limit, int max, String fieldName) {
        if (limit == null) return;

        if (limit < 1 || limit > max) {
            throw new RequestValidationException("limit validation", List.of(
                new ValidationError(
                    fieldName,
                    limit,
                    String.format("%s must be between 1 and %d", fieldName, max),
                    List.of("1 to " + max),
                    String.format("Use a value like %d", Math.max(1, Math.min(max, Math.abs(limit))))
                )
            ), Map.of(fieldName, Math.min(10, max)));
        }
    }

    /**
     * Validate that a free-text invention description is long enough to search with.
     * Length is counted after stripping surrounding whitespace.
     */
    public static void validateInventionDescription(String description, int minLength, String fieldName) {
        validateRequired(description, fieldName, "for prior art search");

        int length = description.strip().length();
        if (length < minLength) {
            throw new ValidationException(
                fieldName,
                length,
                String.format("Invention description must be at least %d characters (got %d)", minLength, length),
                null,
                "Describe the key technical features of the invention in one or two sentences"
            );
        }
    }
}
