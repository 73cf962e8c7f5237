package com.polyglot.translationGateway.translation.service;

import com.polyglot.translationGateway.config.GatewayProperties;
import com.polyglot.translationGateway.translation.exception.ProviderException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;

/**
 * Retry settings for provider calls.
 *
 * Only transient {@link ProviderException}s are retried. The wait after attempt n is
 * {@code base * 2^(n-1)} with 50% jitter, never above the configured maximum.
 */
public final class ProviderRetryConfig {

    static final double MULTIPLIER = 2.0;
    static final double RANDOMIZATION_FACTOR = 0.5;

    private ProviderRetryConfig() {
    }

    public static RetryConfig from(GatewayProperties.Provider provider) {
        long base = provider.getRetryBaseDelayMs();
        long max = Math.max(base, provider.getRetryMaxDelayMs());
        return RetryConfig.custom()
                .maxAttempts(provider.getMaxRetries())
                .intervalFunction(backoff(base, max))
                .retryOnException(ProviderRetryConfig::isRetryable)
                .build();
    }

    static IntervalFunction backoff(long baseMs, long maxMs) {
        IntervalFunction jittered = IntervalFunction.ofExponentialRandomBackoff(baseMs, MULTIPLIER, RANDOMIZATION_FACTOR, maxMs);
        return attempt -> Math.min(maxMs, jittered.apply(attempt));
    }

    static boolean isRetryable(Throwable throwable) {
        return throwable instanceof ProviderException providerException && providerException.isRetryable();
    }
}
