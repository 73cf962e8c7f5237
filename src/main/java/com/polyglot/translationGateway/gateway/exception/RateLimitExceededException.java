package com.polyglot.translationGateway.gateway.exception;

/**
 * Exception thrown when rate limit is exceeded.
 */
public class RateLimitExceededException extends RuntimeException {

    private final long retryAfterMs;

    public RateLimitExceededException(String message, long retryAfterMs) {
        super(message);
        this.retryAfterMs = retryAfterMs;
    }

    public long getRetryAfterMs() {
        return retryAfterMs;
    }

    /**
     * Value for the {@code Retry-After} header, whole seconds rounded up.
     */
    public long getRetryAfterSeconds() {
        return Math.max(1L, (retryAfterMs + 999L) / 1000L);
    }
}
