package com.polyglot.translationGateway.gateway.model;

import lombok.Value;

/**
 * Outcome of one admission check.
 */
@Value
public class RateLimitDecision {

    boolean allowed;

    int remaining;

    /**
     * Time until the current window closes. Zero when the request was admitted.
     */
    long retryAfterMs;

    public static RateLimitDecision admitted(int remaining) {
        return new RateLimitDecision(true, remaining, 0L);
    }

    public static RateLimitDecision rejected(long retryAfterMs) {
        return new RateLimitDecision(false, 0, Math.max(1L, retryAfterMs));
    }
}
