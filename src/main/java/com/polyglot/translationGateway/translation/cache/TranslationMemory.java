package com.polyglot.translationGateway.translation.cache;

import java.util.Optional;

/**
 * Translation memory: content-addressed store of previously computed translations.
 *
 * Implementations are shared process-wide and must be safe for concurrent use.
 * A {@link #store} followed by {@link #lookup} of the same key returns the stored
 * entry until it expires or is evicted for size.
 */
public interface TranslationMemory {

    /**
     * Looks up a live entry. Expired entries are reported as a miss.
     *
     * @param key cache key
     * @return the entry, or empty on miss
     */
    Optional<CacheEntry> lookup(CacheKey key);

    /**
     * Upserts an entry. An existing live entry with a higher write sequence is kept.
     *
     * @param key   cache key
     * @param entry entry to store, carrying its own expiry
     * @return true if the entry is now the stored one
     */
    boolean store(CacheKey key, CacheEntry entry);

    void evict(CacheKey key);

    void evictAll();

    /**
     * Returns a new, strictly increasing write sequence.
     */
    long nextWriteSequence();

    CacheStatsSnapshot stats();
}
