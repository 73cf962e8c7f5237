package com.polyglot.translationGateway.gateway.exception;

/**
 * Exception thrown when a presented credential is not accepted, or cannot be checked in time.
 */
public class ForbiddenException extends RuntimeException {

    public ForbiddenException(String message) {
        super(message);
    }

    public ForbiddenException(String message, Throwable cause) {
        super(message, cause);
    }
}
