package com.polyglot.translationGateway.translation.model;

import java.util.Locale;

/**
 * Payload format of a translation unit. HTML payloads keep their markup untouched.
 */
public enum TextFormat {
    TEXT("text"),
    HTML("html");

    private final String wireValue;

    TextFormat(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * Resolves a wire value ("text" / "html"), case-insensitively.
     *
     * @param value wire value, null means the default format
     * @return matching format, or null if the value is not recognized
     */
    public static TextFormat fromWireValue(String value) {
        if (value == null) {
            return TEXT;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TextFormat format : values()) {
            if (format.wireValue.equals(normalized)) {
                return format;
            }
        }
        return null;
    }
}
