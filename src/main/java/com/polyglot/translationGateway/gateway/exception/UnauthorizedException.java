package com.polyglot.translationGateway.gateway.exception;

/**
 * Exception thrown when the request carries no usable bearer credential.
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
