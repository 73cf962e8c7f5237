package com.polyglot.translationGateway.translation.exception;

import com.polyglot.translationGateway.translation.provider.ProviderErrorKind;

/**
 * Exception thrown by a translation provider when a call fails.
 */
public class ProviderException extends RuntimeException {

    private final String providerId;
    private final ProviderErrorKind kind;
    private final String reason;

    public ProviderException(String providerId, ProviderErrorKind kind, String reason, String message) {
        super(message);
        this.providerId = providerId;
        this.kind = kind;
        this.reason = reason;
    }

    public ProviderException(String providerId, ProviderErrorKind kind, String reason, String message, Throwable cause) {
        super(message, cause);
        this.providerId = providerId;
        this.kind = kind;
        this.reason = reason;
    }

    public static ProviderException transientError(String providerId, String reason, String message) {
        return new ProviderException(providerId, ProviderErrorKind.TRANSIENT, reason, message);
    }

    public static ProviderException transientError(String providerId, String reason, String message, Throwable cause) {
        return new ProviderException(providerId, ProviderErrorKind.TRANSIENT, reason, message, cause);
    }

    public static ProviderException permanent(String providerId, String reason, String message) {
        return new ProviderException(providerId, ProviderErrorKind.PERMANENT, reason, message);
    }

    public static ProviderException permanent(String providerId, String reason, String message, Throwable cause) {
        return new ProviderException(providerId, ProviderErrorKind.PERMANENT, reason, message, cause);
    }

    public String getProviderId() {
        return providerId;
    }

    public ProviderErrorKind getKind() {
        return kind;
    }

    public String getReason() {
        return reason;
    }

    public boolean isRetryable() {
        return kind == ProviderErrorKind.TRANSIENT;
    }
}
