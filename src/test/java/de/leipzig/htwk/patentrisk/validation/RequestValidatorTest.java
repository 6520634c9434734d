package de.leipzig.htwk.patentrisk.validation;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;

import org.junit.jupiter.api.Test;

import de.leipzig.htwk.patentrisk.exception.RequestValidationException;
import de.leipzig.htwk.patentrisk.exception.ValidationException;

class RequestValidatorTest {

    @Test
    void requiredRejectsNullAndBlank() {
        RequestValidationException ex = assertThrows(RequestValidationException.class,
            () -> RequestValidator.validateRequired("  ", "query", "for patent search"));

        assertEquals("query", ex.getField());
        assertEquals("query is required for patent search", ex.getMessage());
        assertThrows(RequestValidationException.class, () -> RequestValidator.validateRequired(null, "query", "for search"));
    }

    @Test
    void limitMustBeWithinRange() {
        assertDoesNotThrow(() -> RequestValidator.validateLimit(null, 100, "limit"));
        assertDoesNotThrow(() -> RequestValidator.validateLimit(1, 100, "limit"));
        assertDoesNotThrow(() -> RequestValidator.validateLimit(100, 100, "limit"));

        RequestValidationException ex = assertThrows(RequestValidationException.class,
            () -> RequestValidator.validateLimit(101, 100, "limit"));
        assertEquals(Map.of("limit", 10), ex.getValidExample());
        assertEquals("Use a value like 100", ex.getValidationErrors().get(0).getSuggestion());

        assertThrows(RequestValidationException.class, () -> RequestValidator.validateLimit(0, 100, "limit"));
        assertThrows(RequestValidationException.class, () -> RequestValidator.validateLimit(-3, 100, "limit"));
    }

    @Test
    void inventionDescriptionLengthIsCountedAfterStripping() {
        String fifty = "x".repeat(50);

        assertDoesNotThrow(() -> RequestValidator.validateInventionDescription(fifty, 50, "inventionDescription"));

        ValidationException ex = assertThrows(ValidationException.class,
            () -> RequestValidator.validateInventionDescription("   " + "x".repeat(49) + "   ", 50, "inventionDescription"));
        assertEquals(49, ex.getProvidedValue());
        assertEquals("Invention description must be at least 50 characters (got 49)", ex.getMessage());
    }
}
