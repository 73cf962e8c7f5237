package com.polyglot.translationGateway.gateway.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.polyglot.translationGateway.auth.model.Identity;
import com.polyglot.translationGateway.config.GatewayProperties;
import com.polyglot.translationGateway.gateway.model.RateLimitDecision;
import com.polyglot.translationGateway.gateway.model.RateLimitWindow;
import com.polyglot.translationGateway.gateway.util.IdentityMasker;
import com.polyglot.translationGateway.telemetry.GatewayMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * In-memory fixed window rate limiter, one window per identity subject.
 *
 * Rollover check and increment happen inside one {@code compute} call on the window map,
 * so concurrent requests of the same identity never admit more than the limit.
 * Idle identities expire after two windows.
 */
@Slf4j
@Service
public class RateLimiter {

    private final long windowMs;
    private final int maxRequests;
    private final Clock clock;
    private final GatewayMetrics metrics;

    // subjectId -> current window
    private final Cache<String, RateLimitWindow> windows;

    public RateLimiter(GatewayProperties properties, Clock clock, GatewayMetrics metrics) {
        this.windowMs = properties.getRateLimit().getWindowMs();
        this.maxRequests = properties.getRateLimit().getMaxRequests();
        this.clock = clock;
        this.metrics = metrics;
        this.windows = Caffeine.newBuilder()
                .expireAfterAccess(Duration.ofMillis(windowMs * 2))
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
    }

    /**
     * Counts the request against the identity's current window.
     *
     * @param identity authenticated caller
     * @return admission decision; a rejection carries the time until the window closes
     */
    public RateLimitDecision admit(Identity identity) {
        long now = clock.millis();
        boolean[] admitted = new boolean[1];

        RateLimitWindow window = windows.asMap().compute(identity.getSubjectId(), (subject, current) -> {
            if (current == null || current.isExpired(now, windowMs)) {
                admitted[0] = true;
                return new RateLimitWindow(now, 1, maxRequests);
            }
            if (current.getCount() >= current.getLimit()) {
                admitted[0] = false;
                return current;
            }
            admitted[0] = true;
            return current.increment();
        });

        if (admitted[0]) {
            return RateLimitDecision.admitted(window.getLimit() - window.getCount());
        }

        long retryAfterMs = window.getWindowStartMs() + windowMs - now;
        metrics.rateLimitRejected();
        log.warn("Rate limit exceeded for subject: {}, retryAfterMs: {}",
                IdentityMasker.mask(identity.getSubjectId()), retryAfterMs);
        return RateLimitDecision.rejected(retryAfterMs);
    }
}
