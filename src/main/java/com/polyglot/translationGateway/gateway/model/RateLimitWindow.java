package com.polyglot.translationGateway.gateway.model;

import lombok.Value;

/**
 * Fixed window counter of one identity. Replaced on every admission, never mutated.
 */
@Value
public class RateLimitWindow {

    long windowStartMs;

    int count;

    int limit;

    public boolean isExpired(long nowMs, long windowMs) {
        return nowMs >= windowStartMs + windowMs;
    }

    public RateLimitWindow increment() {
        return new RateLimitWindow(windowStartMs, count + 1, limit);
    }
}
