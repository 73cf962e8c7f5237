package com.polyglot.translationGateway.translation.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Ordered sequence of units plus shared options. Result order mirrors {@link #units}.
 */
@Value
@Builder
public class BatchRequest {

    @NonNull
    @Singular
    List<TranslationUnit> units;

    @NonNull
    @Builder.Default
    BatchOptions options = BatchOptions.NONE;

    /**
     * Correlation ID for logging and tracking.
     */
    String correlationId;

    public int size() {
        return units.size();
    }
}
