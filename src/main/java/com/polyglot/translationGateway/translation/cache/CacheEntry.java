package com.polyglot.translationGateway.translation.cache;

import com.polyglot.translationGateway.translation.model.ProviderResult;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Stored translation. Never mutated; a newer entry replaces it.
 */
@Value
@Builder
public class CacheEntry {

    CacheKey key;

    String resultText;

    String detectedSource;

    String providerId;

    Instant createdAt;

    Instant expiresAt;

    /**
     * Sequence stamped when the provider call that produced this entry was dispatched.
     * Higher wins when two writes race on the same key.
     */
    long writeSequence;

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public static CacheEntry of(CacheKey key, ProviderResult result, Instant now, Duration ttl, long writeSequence) {
        return CacheEntry.builder()
                .key(key)
                .resultText(result.getText())
                .detectedSource(result.getDetectedSource())
                .providerId(result.getProviderId())
                .createdAt(now)
                .expiresAt(now.plus(ttl))
                .writeSequence(writeSequence)
                .build();
    }
}
