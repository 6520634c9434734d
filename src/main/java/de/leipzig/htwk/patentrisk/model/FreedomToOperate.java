package de.leipzig.htwk.patentrisk.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FreedomToOperate {
    LIKELY("likely"),
    UNCERTAIN("uncertain"),
    UNLIKELY("unlikely");

    private final String value;

    FreedomToOperate(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Lenient parse for free-form collaborator output, null when nothing matches
     */
    public static FreedomToOperate fromString(String input) {
        if (input == null) {
            return null;
        }
        return switch (input.toLowerCase(Locale.ROOT).trim()) {
            case "likely" -> LIKELY;
            case "uncertain", "unclear" -> UNCERTAIN;
            case "unlikely" -> UNLIKELY;
            default -> null;
        };
    }
}
