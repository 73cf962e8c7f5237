package com.polyglot.translationGateway.translation.model;

import lombok.Builder;
import lombok.Value;

/**
 * Result of one unit returned by a translation provider.
 */
@Value
@Builder
public class ProviderResult {

    String text;

    /**
     * Language the provider detected, populated when the unit asked for auto detection.
     */
    String detectedSource;

    String providerId;

    long latencyMs;
}
