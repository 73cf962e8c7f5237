package com.polyglot.translationGateway.language.service;

import com.polyglot.translationGateway.language.model.LanguageDetectionResult;
import com.polyglot.translationGateway.translation.exception.ProviderException;
import com.polyglot.translationGateway.translation.provider.ProviderRegistry;
import com.polyglot.translationGateway.translation.provider.TranslationProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Language detection over the provider chain.
 *
 * Providers that support detection are asked in chain order; the first answer wins.
 * When every provider fails the in-process {@link LanguageDetector} answers, so
 * detection never fails for a non-blank text.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LanguageDetectionService {

    private final ProviderRegistry providerRegistry;
    private final LanguageDetector languageDetector;

    public LanguageDetectionResult detect(String text, String correlationId) {
        for (TranslationProvider provider : providerRegistry.chain()) {
            if (!provider.supportsDetection()) {
                continue;
            }
            try {
                LanguageDetectionResult result = provider.detect(text);
                if (result != null && result.getLanguageCode() != null && !result.getLanguageCode().isBlank()) {
                    log.debug("Language detected - correlationId: {}, provider: {}, language: {}",
                            correlationId, provider.id(), result.getLanguageCode());
                    return result.clamped();
                }
                log.warn("Provider returned no language - correlationId: {}, provider: {}", correlationId, provider.id());
            } catch (ProviderException e) {
                log.warn("Language detection failed - correlationId: {}, provider: {}, kind: {}, reason: {}",
                        correlationId, provider.id(), e.getKind(), e.getReason());
            }
        }

        log.info("Falling back to heuristic language detection - correlationId: {}", correlationId);
        return languageDetector.detectLanguage(text).clamped();
    }
}
