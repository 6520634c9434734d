package de.leipzig.htwk.patentrisk.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Statutory category of a claim as detected from its preamble
 */
public enum ClaimType {
    APPARATUS("apparatus"),
    METHOD("method"),
    SYSTEM("system"),
    UNSPECIFIED("unspecified");

    private final String value;

    ClaimType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parse a stored claim type, case-insensitive. Unknown or empty values map to UNSPECIFIED.
     */
    public static ClaimType fromString(String input) {
        if (input == null || input.trim().isEmpty()) {
            return UNSPECIFIED;
        }
        return switch (input.toLowerCase(Locale.ROOT).trim()) {
            case "apparatus", "device", "machine" -> APPARATUS;
            case "method", "process" -> METHOD;
            case "system" -> SYSTEM;
            default -> UNSPECIFIED;
        };
    }
}
