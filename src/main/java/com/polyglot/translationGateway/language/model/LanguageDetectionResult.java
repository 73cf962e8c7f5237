package com.polyglot.translationGateway.language.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of language detection.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LanguageDetectionResult {
    
    /**
     * Detected language code (ISO-style, opaque to the gateway core).
     */
    private String languageCode;
    
    /**
     * Confidence score (0.0 to 1.0) indicating detection confidence.
     */
    private double confidence;

    /**
     * Returns a copy with the confidence clamped into [0, 1].
     */
    public LanguageDetectionResult clamped() {
        double bounded = Double.isNaN(confidence) ? 0.0 : Math.max(0.0, Math.min(1.0, confidence));
        return new LanguageDetectionResult(languageCode, bounded);
    }
}
