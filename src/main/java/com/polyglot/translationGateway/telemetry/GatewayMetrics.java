package com.polyglot.translationGateway.telemetry;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer emission hooks for the request pipeline.
 *
 * Tags stay low-cardinality: provider id, outcome and result kind only.
 * A null registry turns every hook into a no-op.
 */
public final class GatewayMetrics {

    private final MeterRegistry registry;

    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();

    public GatewayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public static GatewayMetrics noop() {
        return new GatewayMetrics(null);
    }

    public void cacheLookup(String result) {
        increment("gateway.cache.lookups", "result", result);
    }

    public void providerCall(String providerId, String outcome, long latencyMs) {
        if (registry == null) {
            return;
        }
        String provider = safeTag(providerId);
        counters.computeIfAbsent("calls|" + provider + "|" + safeTag(outcome),
                k -> Counter.builder("gateway.provider.calls")
                        .tag("provider", provider)
                        .tag("outcome", safeTag(outcome))
                        .register(registry))
                .increment();
        timers.computeIfAbsent(provider,
                k -> Timer.builder("gateway.provider.latency")
                        .tag("provider", provider)
                        .register(registry))
                .record(Duration.ofMillis(Math.max(0, latencyMs)));
    }

    public void providerRetry(String providerId) {
        increment("gateway.provider.retries", "provider", providerId);
    }

    public void rateLimitRejected() {
        increment("gateway.ratelimit.rejections", "outcome", "rejected");
    }

    public void authDecision(String outcome) {
        increment("gateway.auth.decisions", "outcome", outcome);
    }

    private void increment(String name, String tagKey, String tagValue) {
        if (registry == null) {
            return;
        }
        String value = safeTag(tagValue);
        counters.computeIfAbsent(name + "|" + value,
                k -> Counter.builder(name).tag(tagKey, value).register(registry))
                .increment();
    }

    private static String safeTag(String raw) {
        if (raw == null || raw.isBlank()) {
            return "none";
        }
        String s = raw.trim();
        if (s.length() > 64) {
            s = s.substring(0, 64);
        }
        return s.toLowerCase(Locale.ROOT).replace(' ', '_');
    }
}
