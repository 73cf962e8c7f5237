package com.polyglot.translationGateway.translation.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Translation memory backed by a Caffeine cache.
 *
 * Each entry expires at its own {@link CacheEntry#getExpiresAt()}; Caffeine's ticker
 * is derived from the injected clock so both views of time agree.
 * The cache is bounded by entry count with Caffeine's size eviction.
 */
@Slf4j
public class CaffeineTranslationMemory implements TranslationMemory {

    private final Cache<CacheKey, CacheEntry> cache;
    private final Clock clock;
    private final AtomicLong writeSequence = new AtomicLong();

    public CaffeineTranslationMemory(long maxEntries, Clock clock) {
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfter(new EntryExpiry())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                // maintenance runs on the calling thread so size bounds hold on return
                .executor(Runnable::run)
                .recordStats()
                .removalListener((CacheKey key, CacheEntry value, RemovalCause cause) -> {
                    if (cause.wasEvicted()) {
                        log.debug("Translation memory entry removed - key: {}, cause: {}", key, cause);
                    }
                })
                .build();
    }

    @Override
    public Optional<CacheEntry> lookup(CacheKey key) {
        CacheEntry entry = cache.getIfPresent(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            cache.asMap().remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    @Override
    public boolean store(CacheKey key, CacheEntry entry) {
        Instant now = clock.instant();
        CacheEntry stored = cache.asMap().compute(key, (k, existing) -> {
            if (existing != null
                    && !existing.isExpired(now)
                    && existing.getWriteSequence() > entry.getWriteSequence()) {
                return existing;
            }
            return entry;
        });
        if (stored != entry) {
            log.debug("Kept newer translation memory entry - key: {}, storedSequence: {}, rejectedSequence: {}",
                    key, stored.getWriteSequence(), entry.getWriteSequence());
            return false;
        }
        return true;
    }

    @Override
    public void evict(CacheKey key) {
        cache.invalidate(key);
    }

    @Override
    public void evictAll() {
        cache.invalidateAll();
    }

    @Override
    public long nextWriteSequence() {
        return writeSequence.incrementAndGet();
    }

    @Override
    public CacheStatsSnapshot stats() {
        cache.cleanUp();
        CacheStats stats = cache.stats();
        return CacheStatsSnapshot.builder()
                .size(cache.estimatedSize())
                .hitCount(stats.hitCount())
                .missCount(stats.missCount())
                .evictionCount(stats.evictionCount())
                .build();
    }

    private static final class EntryExpiry implements Expiry<CacheKey, CacheEntry> {

        @Override
        public long expireAfterCreate(CacheKey key, CacheEntry value, long currentTime) {
            return nanosUntilExpiry(value, currentTime);
        }

        @Override
        public long expireAfterUpdate(CacheKey key, CacheEntry value, long currentTime, long currentDuration) {
            return nanosUntilExpiry(value, currentTime);
        }

        @Override
        public long expireAfterRead(CacheKey key, CacheEntry value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private static long nanosUntilExpiry(CacheEntry value, long currentTime) {
            long expiresAtNanos = TimeUnit.MILLISECONDS.toNanos(value.getExpiresAt().toEpochMilli());
            return Math.max(0L, expiresAtNanos - currentTime);
        }
    }
}
