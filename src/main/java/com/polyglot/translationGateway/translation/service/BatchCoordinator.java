package com.polyglot.translationGateway.translation.service;

import com.polyglot.translationGateway.config.GatewayProperties;
import com.polyglot.translationGateway.telemetry.GatewayMetrics;
import com.polyglot.translationGateway.translation.cache.CacheEntry;
import com.polyglot.translationGateway.translation.cache.CacheKey;
import com.polyglot.translationGateway.translation.cache.TranslationMemory;
import com.polyglot.translationGateway.translation.exception.PartialFailureException;
import com.polyglot.translationGateway.translation.exception.ProviderException;
import com.polyglot.translationGateway.translation.exception.RequestCancelledException;
import com.polyglot.translationGateway.translation.exception.RequestTimeoutException;
import com.polyglot.translationGateway.translation.exception.TotalFailureException;
import com.polyglot.translationGateway.translation.model.BatchOptions;
import com.polyglot.translationGateway.translation.model.BatchRequest;
import com.polyglot.translationGateway.translation.model.BatchResult;
import com.polyglot.translationGateway.translation.model.ProviderResult;
import com.polyglot.translationGateway.translation.model.TranslationUnit;
import com.polyglot.translationGateway.translation.model.UnitFailure;
import com.polyglot.translationGateway.translation.model.UnitOutcome;
import com.polyglot.translationGateway.translation.provider.ProviderRegistry;
import com.polyglot.translationGateway.translation.provider.TranslationProvider;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Batch Coordinator - orchestrates one translation batch.
 *
 * Responsibilities:
 * - Split the batch into translation memory hits and misses, keeping original indices
 * - Group misses into provider calls of at most {@code gateway.provider.max-units-per-call} units
 * - Run groups concurrently through the provider chain, retrying transient errors with backoff
 *   and falling back to the next provider when one gives up
 * - Write successful results to the translation memory and merge everything back in request order
 *
 * A failed group only affects its own units. The whole dispatch is bounded by
 * {@code gateway.request-timeout-ms}; a timed out request caches nothing.
 */
@Slf4j
@Service
public class BatchCoordinator {

    public static final String PASS_THROUGH_PROVIDER = "pass-through";

    private final TranslationMemory translationMemory;
    private final ProviderRegistry providerRegistry;
    private final ExecutorService providerExecutor;
    private final RetryRegistry retryRegistry;
    private final ConcurrentMap<String, Retry> retries = new ConcurrentHashMap<>();
    private final GatewayProperties properties;
    private final Clock clock;
    private final GatewayMetrics metrics;

    public BatchCoordinator(
            TranslationMemory translationMemory,
            ProviderRegistry providerRegistry,
            @Qualifier("providerExecutor") ExecutorService providerExecutor,
            RetryRegistry retryRegistry,
            GatewayProperties properties,
            Clock clock,
            GatewayMetrics metrics) {
        this.translationMemory = translationMemory;
        this.providerRegistry = providerRegistry;
        this.providerExecutor = providerExecutor;
        this.retryRegistry = retryRegistry;
        this.properties = properties;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Translates a batch.
     *
     * @param request batch with units in caller order
     * @return outcomes index-aligned with the request, all successful
     * @throws PartialFailureException if some units failed
     * @throws TotalFailureException if every unit failed
     * @throws RequestTimeoutException if providers did not finish within the request timeout
     */
    public BatchResult translate(BatchRequest request) {
        String correlationId = request.getCorrelationId();
        List<TranslationUnit> units = request.getUnits();
        BatchOptions options = request.getOptions();

        UnitOutcome[] outcomes = new UnitOutcome[units.size()];
        List<PendingUnit> misses = new ArrayList<>();
        int cacheHits = 0;

        for (int i = 0; i < units.size(); i++) {
            TranslationUnit unit = units.get(i);
            if (unit.isPassThrough()) {
                outcomes[i] = UnitOutcome.success(i, unit.getText(), null, PASS_THROUGH_PROVIDER, false);
                continue;
            }
            CacheKey key = CacheKey.of(unit, options);
            Optional<CacheEntry> cached = lookupQuietly(key, correlationId);
            if (cached.isPresent()) {
                CacheEntry entry = cached.get();
                String detectedSource = unit.isAutoDetect() ? entry.getDetectedSource() : null;
                outcomes[i] = UnitOutcome.success(i, entry.getResultText(), detectedSource, entry.getProviderId(), true);
                cacheHits++;
            } else {
                misses.add(new PendingUnit(i, unit, key));
            }
        }

        log.info("Batch partitioned - correlationId: {}, units: {}, cacheHits: {}, misses: {}",
                correlationId, units.size(), cacheHits, misses.size());

        if (misses.isEmpty()) {
            return assemble(outcomes, cacheHits, 0, correlationId);
        }

        List<List<PendingUnit>> groups = partition(misses, properties.getProvider().getMaxUnitsPerCall());
        List<GroupOutcome> groupOutcomes = dispatch(groups, options, correlationId);

        Instant now = clock.instant();
        Duration ttl = properties.getCache().ttl();
        for (GroupOutcome groupOutcome : groupOutcomes) {
            List<PendingUnit> group = groupOutcome.units();
            if (groupOutcome.failure() != null) {
                for (PendingUnit pending : group) {
                    outcomes[pending.index()] = UnitOutcome.failed(toFailure(pending.index(), groupOutcome.failure()));
                }
                continue;
            }
            for (int j = 0; j < group.size(); j++) {
                PendingUnit pending = group.get(j);
                ProviderResult result = groupOutcome.results().get(j);
                storeQuietly(pending.key(), CacheEntry.of(pending.key(), result, now, ttl, groupOutcome.writeSequence()), correlationId);
                String detectedSource = pending.unit().isAutoDetect() ? result.getDetectedSource() : null;
                outcomes[pending.index()] = UnitOutcome.success(
                        pending.index(), result.getText(), detectedSource, result.getProviderId(), false);
            }
        }

        return assemble(outcomes, cacheHits, groups.size(), correlationId);
    }

    private List<GroupOutcome> dispatch(List<List<PendingUnit>> groups, BatchOptions options, String correlationId) {
        long timeoutMs = properties.getRequestTimeoutMs();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        List<Future<GroupOutcome>> futures = new ArrayList<>(groups.size());
        try {
            for (List<PendingUnit> group : groups) {
                futures.add(providerExecutor.submit(() -> dispatchGroup(group, options, correlationId)));
            }
            List<GroupOutcome> results = new ArrayList<>(groups.size());
            for (int g = 0; g < futures.size(); g++) {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                try {
                    results.add(futures.get(g).get(remaining, TimeUnit.NANOSECONDS));
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.error("Provider group failed unexpectedly - correlationId: {}", correlationId, cause);
                    results.add(GroupOutcome.failed(groups.get(g), ProviderException.transientError(
                            "none", "INTERNAL_ERROR", "Unexpected provider failure: " + cause.getMessage(), cause)));
                }
            }
            return results;
        } catch (TimeoutException e) {
            cancelAll(futures);
            log.warn("Batch timed out, provider calls cancelled - correlationId: {}, timeoutMs: {}, groups: {}",
                    correlationId, timeoutMs, groups.size());
            throw new RequestTimeoutException("Translation did not complete within " + timeoutMs + " ms");
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            log.warn("Batch cancelled, provider calls abandoned - correlationId: {}", correlationId);
            throw new RequestCancelledException("Translation request was cancelled", e);
        } catch (RejectedExecutionException e) {
            cancelAll(futures);
            throw e;
        }
    }

    private GroupOutcome dispatchGroup(List<PendingUnit> group, BatchOptions options, String correlationId)
            throws InterruptedException {
        List<TranslationUnit> units = group.stream().map(PendingUnit::unit).toList();
        ProviderException lastFailure = null;
        for (TranslationProvider provider : providerRegistry.chain()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Provider dispatch cancelled");
            }
            try {
                return callWithRetry(provider, group, units, options, correlationId);
            } catch (ProviderException e) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("Provider dispatch cancelled");
                }
                lastFailure = e;
                log.warn("Provider gave up on group - correlationId: {}, provider: {}, kind: {}, reason: {}, units: {}, error: {}",
                        correlationId, provider.id(), e.getKind(), e.getReason(), units.size(), e.getMessage());
            }
        }
        return GroupOutcome.failed(group, lastFailure);
    }

    private GroupOutcome callWithRetry(TranslationProvider provider, List<PendingUnit> group, List<TranslationUnit> units,
                                       BatchOptions options, String correlationId) {
        Retry retry = retryFor(provider.id());
        AtomicInteger attempts = new AtomicInteger();
        return retry.executeSupplier(() -> {
            int attempt = attempts.incrementAndGet();
            if (Thread.currentThread().isInterrupted()) {
                throw ProviderException.permanent(provider.id(), "CANCELLED", "Provider dispatch cancelled");
            }
            long writeSequence = nextWriteSequenceQuietly(correlationId);
            long started = System.nanoTime();
            try {
                List<ProviderResult> results = provider.translateBatch(units, options);
                validateResults(provider, results, units.size());
                metrics.providerCall(provider.id(), "success", elapsedMs(started));
                log.debug("Provider call succeeded - correlationId: {}, provider: {}, attempt: {}, units: {}",
                        correlationId, provider.id(), attempt, units.size());
                return GroupOutcome.succeeded(group, results, writeSequence);
            } catch (RuntimeException e) {
                ProviderException failure = e instanceof ProviderException providerException
                        ? providerException
                        : ProviderException.transientError(provider.id(), "UNEXPECTED", e.getMessage(), e);
                metrics.providerCall(provider.id(), failure.getKind().name(), elapsedMs(started));
                log.debug("Provider attempt failed - correlationId: {}, provider: {}, attempt: {}, reason: {}",
                        correlationId, provider.id(), attempt, failure.getReason());
                throw failure;
            }
        });
    }

    private Retry retryFor(String providerId) {
        return retries.computeIfAbsent(providerId, id -> {
            Retry retry = retryRegistry.retry("provider-" + id);
            retry.getEventPublisher().onRetry(event -> {
                metrics.providerRetry(id);
                log.info("Transient provider error, retrying - provider: {}, attempt: {}/{}, waitMs: {}, error: {}",
                        id, event.getNumberOfRetryAttempts(), retry.getRetryConfig().getMaxAttempts(),
                        event.getWaitInterval().toMillis(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown");
            });
            return retry;
        });
    }

    private void validateResults(TranslationProvider provider, List<ProviderResult> results, int expected) {
        if (results == null || results.size() != expected) {
            throw ProviderException.transientError(provider.id(), "RESULT_SIZE_MISMATCH",
                    "Provider " + provider.id() + " returned " + (results == null ? 0 : results.size())
                            + " results for " + expected + " units");
        }
        for (ProviderResult result : results) {
            if (result == null || result.getText() == null) {
                throw ProviderException.transientError(provider.id(), "MALFORMED_RESPONSE",
                        "Provider " + provider.id() + " returned an empty result");
            }
        }
    }

    private BatchResult assemble(UnitOutcome[] outcomes, int cacheHits, int providerGroups, String correlationId) {
        List<UnitOutcome> ordered = Arrays.asList(outcomes);
        List<UnitFailure> failures = ordered.stream()
                .filter(outcome -> !outcome.isSuccess())
                .map(UnitOutcome::getFailure)
                .toList();

        if (failures.isEmpty()) {
            log.info("Batch translated - correlationId: {}, units: {}, cacheHits: {}, providerGroups: {}",
                    correlationId, ordered.size(), cacheHits, providerGroups);
            return BatchResult.builder()
                    .outcomes(List.copyOf(ordered))
                    .cacheHits(cacheHits)
                    .providerGroups(providerGroups)
                    .build();
        }
        if (failures.size() == ordered.size()) {
            log.warn("Batch failed completely - correlationId: {}, units: {}", correlationId, ordered.size());
            throw new TotalFailureException(failures);
        }
        log.warn("Batch partially failed - correlationId: {}, units: {}, failed: {}",
                correlationId, ordered.size(), failures.size());
        throw new PartialFailureException(ordered);
    }

    private Optional<CacheEntry> lookupQuietly(CacheKey key, String correlationId) {
        try {
            Optional<CacheEntry> entry = translationMemory.lookup(key);
            metrics.cacheLookup(entry.isPresent() ? "hit" : "miss");
            return entry;
        } catch (RuntimeException e) {
            log.warn("Translation memory lookup failed, treating as miss - correlationId: {}, key: {}, error: {}",
                    correlationId, key, e.getMessage());
            metrics.cacheLookup("error");
            return Optional.empty();
        }
    }

    private void storeQuietly(CacheKey key, CacheEntry entry, String correlationId) {
        try {
            translationMemory.store(key, entry);
        } catch (RuntimeException e) {
            log.warn("Translation memory store failed, result not cached - correlationId: {}, key: {}, error: {}",
                    correlationId, key, e.getMessage());
        }
    }

    private long nextWriteSequenceQuietly(String correlationId) {
        try {
            return translationMemory.nextWriteSequence();
        } catch (RuntimeException e) {
            log.warn("Translation memory unavailable for write sequence - correlationId: {}, error: {}",
                    correlationId, e.getMessage());
            return 0L;
        }
    }

    private static UnitFailure toFailure(int index, ProviderException failure) {
        return UnitFailure.builder()
                .index(index)
                .kind(failure.getKind())
                .reason(failure.getReason())
                .message(failure.getMessage())
                .build();
    }

    private static List<List<PendingUnit>> partition(List<PendingUnit> misses, int maxUnitsPerCall) {
        List<List<PendingUnit>> groups = new ArrayList<>();
        for (int from = 0; from < misses.size(); from += maxUnitsPerCall) {
            groups.add(List.copyOf(misses.subList(from, Math.min(misses.size(), from + maxUnitsPerCall))));
        }
        return groups;
    }

    private static void cancelAll(List<Future<GroupOutcome>> futures) {
        for (Future<GroupOutcome> future : futures) {
            future.cancel(true);
        }
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }

    private record PendingUnit(int index, TranslationUnit unit, CacheKey key) {
    }

    private record GroupOutcome(List<PendingUnit> units, List<ProviderResult> results, long writeSequence,
                                ProviderException failure) {

        static GroupOutcome succeeded(List<PendingUnit> units, List<ProviderResult> results, long writeSequence) {
            return new GroupOutcome(units, results, writeSequence, null);
        }

        static GroupOutcome failed(List<PendingUnit> units, ProviderException failure) {
            return new GroupOutcome(units, null, 0L, failure);
        }
    }
}
