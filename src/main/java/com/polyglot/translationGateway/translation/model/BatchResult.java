package com.polyglot.translationGateway.translation.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Fully successful batch translation, index-aligned with the request.
 */
@Value
@Builder
public class BatchResult {

    List<UnitOutcome> outcomes;

    int cacheHits;

    int providerGroups;

    public int size() {
        return outcomes.size();
    }
}
