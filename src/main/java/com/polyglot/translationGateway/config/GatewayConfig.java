package com.polyglot.translationGateway.config;

import com.polyglot.translationGateway.telemetry.GatewayMetrics;
import com.polyglot.translationGateway.translation.cache.CaffeineTranslationMemory;
import com.polyglot.translationGateway.translation.cache.TranslationMemory;
import com.polyglot.translationGateway.translation.service.ProviderRetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wiring for the process-wide shared collaborators: clock, executors,
 * translation memory, provider retry registry and metrics hooks.
 */
@Configuration
public class GatewayConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Pool running provider-call groups. Sized by {@code gateway.provider.parallelism}.
     */
    @Bean(name = "providerExecutor", destroyMethod = "shutdownNow")
    public ExecutorService providerExecutor(GatewayProperties properties) {
        return Executors.newFixedThreadPool(
                properties.getProvider().getParallelism(),
                namedThreads("provider-"));
    }

    /**
     * Pool for credential store lookups, so that a slow store is bounded by a timeout.
     */
    @Bean(name = "authExecutor", destroyMethod = "shutdownNow")
    public ExecutorService authExecutor() {
        return Executors.newCachedThreadPool(namedThreads("auth-"));
    }

    @Bean
    public TranslationMemory translationMemory(GatewayProperties properties, Clock clock) {
        return new CaffeineTranslationMemory(properties.getCache().getMaxEntries(), clock);
    }

    /**
     * One {@code Retry} per provider id is created from this registry on first use.
     */
    @Bean
    public RetryRegistry providerRetryRegistry(GatewayProperties properties) {
        return RetryRegistry.of(ProviderRetryConfig.from(properties.getProvider()));
    }

    @Bean
    public GatewayMetrics gatewayMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        return new GatewayMetrics(meterRegistry.getIfAvailable());
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
