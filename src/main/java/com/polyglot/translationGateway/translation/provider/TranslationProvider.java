package com.polyglot.translationGateway.translation.provider;

import com.polyglot.translationGateway.language.model.LanguageDetectionResult;
import com.polyglot.translationGateway.translation.exception.ProviderException;
import com.polyglot.translationGateway.translation.model.BatchOptions;
import com.polyglot.translationGateway.translation.model.ProviderResult;
import com.polyglot.translationGateway.translation.model.TranslationUnit;

import java.util.List;

/**
 * Uniform capability over a translation backend (cloud API, self-hosted model, on-device model).
 *
 * Callers never branch on the concrete provider. Chunking beyond the backend's
 * physical request limit is the provider's own concern.
 */
public interface TranslationProvider {

    /**
     * Stable id used in configuration ({@code gateway.provider.chain}) and in results.
     */
    String id();

    /**
     * Translates a group of units.
     *
     * @param units   units in request order
     * @param options shared batch options
     * @return one result per unit, in the same order; detected source populated for auto units
     * @throws ProviderException classified as transient or permanent
     */
    List<ProviderResult> translateBatch(List<TranslationUnit> units, BatchOptions options);

    /**
     * Detects the language of a text.
     *
     * @throws ProviderException classified as transient or permanent
     */
    LanguageDetectionResult detect(String text);

    default boolean supportsDetection() {
        return true;
    }
}
