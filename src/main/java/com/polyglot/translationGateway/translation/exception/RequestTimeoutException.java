package com.polyglot.translationGateway.translation.exception;

/**
 * Exception thrown when provider dispatch for a request exceeds the request timeout.
 * Nothing computed for the request is cached.
 */
public class RequestTimeoutException extends RuntimeException {

    public RequestTimeoutException(String message) {
        super(message);
    }
}
