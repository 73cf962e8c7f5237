package com.polyglot.translationGateway.gateway.exception;

/**
 * Exception thrown for request checks that bean validation cannot express.
 */
public class ValidationException extends RuntimeException {

    private final String field;
    private final String reason;

    public ValidationException(String field, String reason) {
        super(field + ": " + reason);
        this.field = field;
        this.reason = reason;
    }

    public String getField() {
        return field;
    }

    public String getReason() {
        return reason;
    }
}
