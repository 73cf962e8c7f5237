package com.polyglot.translationGateway.gateway.exception;

public class SpeechNotConfiguredException extends RuntimeException {

    public SpeechNotConfiguredException(String message) {
        super(message);
    }
}
