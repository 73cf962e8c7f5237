package com.polyglot.translationGateway.translation.model;

import lombok.Builder;
import lombok.Value;

/**
 * Positional outcome of one unit: either a translated text or a failure.
 */
@Value
@Builder
public class UnitOutcome {

    int index;

    String text;

    String detectedSource;

    String providerId;

    boolean fromCache;

    UnitFailure failure;

    public boolean isSuccess() {
        return failure == null;
    }

    public static UnitOutcome success(int index, String text, String detectedSource, String providerId, boolean fromCache) {
        return UnitOutcome.builder()
                .index(index)
                .text(text)
                .detectedSource(detectedSource)
                .providerId(providerId)
                .fromCache(fromCache)
                .build();
    }

    public static UnitOutcome failed(UnitFailure failure) {
        return UnitOutcome.builder()
                .index(failure.getIndex())
                .failure(failure)
                .build();
    }
}
