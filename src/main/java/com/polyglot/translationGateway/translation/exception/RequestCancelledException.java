package com.polyglot.translationGateway.translation.exception;

/**
 * Exception thrown when the thread serving a request is interrupted while waiting for providers.
 */
public class RequestCancelledException extends RuntimeException {

    public RequestCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
