package com.polyglot.translationGateway.translation.provider;

import com.polyglot.translationGateway.language.model.LanguageDetectionResult;
import com.polyglot.translationGateway.translation.dto.SelfHostedTranslateRequest;
import com.polyglot.translationGateway.translation.dto.SelfHostedTranslateResponse;
import com.polyglot.translationGateway.translation.exception.ProviderException;
import com.polyglot.translationGateway.translation.model.BatchOptions;
import com.polyglot.translationGateway.translation.model.ProviderResult;
import com.polyglot.translationGateway.translation.model.TranslationUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Provider for a self-hosted, LibreTranslate-compatible translation server.
 * 
 * The backend translates one (source, target, format) combination per call, so a group is
 * split by that combination and then into chunks of at most {@code self-hosted.api.max-batch-size}
 * texts. Results are written back to their original positions.
 * The protocol has no glossary or register parameter, so batches asking for either fail
 * permanently before any call and the chain moves on to the next provider.
 */
@Slf4j
@Service
public class SelfHostedTranslationProvider implements TranslationProvider {

    public static final String ID = "self-hosted";

    private final RestClient restClient;
    private final String apiKey;
    private final int maxBatchSize;

    @Autowired
    public SelfHostedTranslationProvider(
            @Value("${self-hosted.api.url:http://localhost:5000}") String url,
            @Value("${self-hosted.api.key:}") String apiKey,
            @Value("${self-hosted.api.max-batch-size:50}") int maxBatchSize,
            @Value("${self-hosted.api.timeout-ms:10000}") int timeoutMs) {
        this(RestClient.builder()
                        .baseUrl(url)
                        .requestFactory(requestFactory(timeoutMs))
                        .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                        .build(),
                apiKey, maxBatchSize);
    }

    SelfHostedTranslationProvider(RestClient restClient, String apiKey, int maxBatchSize) {
        this.restClient = restClient;
        this.apiKey = apiKey == null || apiKey.isBlank() ? null : apiKey;
        this.maxBatchSize = Math.max(1, maxBatchSize);
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<ProviderResult> translateBatch(List<TranslationUnit> units, BatchOptions options) {
        requireSupported(options);
        ProviderResult[] results = new ProviderResult[units.size()];

        Map<String, List<Integer>> byCombination = new LinkedHashMap<>();
        for (int i = 0; i < units.size(); i++) {
            TranslationUnit unit = units.get(i);
            String combination = unit.getSourceLang() + '|' + unit.getTargetLang() + '|' + unit.getFormat().wireValue();
            byCombination.computeIfAbsent(combination, k -> new ArrayList<>()).add(i);
        }

        for (List<Integer> positions : byCombination.values()) {
            for (int from = 0; from < positions.size(); from += maxBatchSize) {
                List<Integer> chunk = positions.subList(from, Math.min(positions.size(), from + maxBatchSize));
                translateChunk(units, chunk, results);
            }
        }
        return Arrays.asList(results);
    }

    @Override
    public LanguageDetectionResult detect(String text) {
        List<SelfHostedTranslateResponse.DetectedLanguage> detections;
        try {
            Map<String, String> body = new LinkedHashMap<>();
            body.put("q", text);
            if (apiKey != null) {
                body.put("api_key", apiKey);
            }
            detections = restClient.post()
                    .uri("/detect")
                    .body(body)
                    .retrieve()
                    .body(new ParameterizedTypeReference<List<SelfHostedTranslateResponse.DetectedLanguage>>() {
                    });
        } catch (RestClientException e) {
            throw ProviderErrorClassifier.classify(ID, e);
        }
        if (detections == null || detections.isEmpty() || detections.get(0).getLanguage() == null) {
            throw ProviderException.transientError(ID, "EMPTY_RESPONSE", "Self-hosted detection returned no language");
        }
        SelfHostedTranslateResponse.DetectedLanguage best = detections.get(0);
        return LanguageDetectionResult.builder()
                .languageCode(best.getLanguage())
                .confidence(toUnitInterval(best.getConfidence()))
                .build()
                .clamped();
    }

    private static void requireSupported(BatchOptions options) {
        if (options.getGlossaryId() != null) {
            throw ProviderException.permanent(ID, "GLOSSARY_UNSUPPORTED",
                    "Self-hosted provider cannot apply glossary " + options.getGlossaryId());
        }
        if (options.getFormality() != null && !options.getFormality().isBlank()) {
            throw ProviderException.permanent(ID, "FORMALITY_UNSUPPORTED",
                    "Self-hosted provider cannot apply formality " + options.getFormality());
        }
    }

    private void translateChunk(List<TranslationUnit> units, List<Integer> positions, ProviderResult[] results) {
        TranslationUnit first = units.get(positions.get(0));
        List<String> texts = new ArrayList<>(positions.size());
        for (Integer position : positions) {
            texts.add(units.get(position).getText());
        }

        SelfHostedTranslateRequest request = SelfHostedTranslateRequest.builder()
                .q(texts)
                .source(first.getSourceLang())
                .target(first.getTargetLang())
                .format(first.getFormat().wireValue())
                .apiKey(apiKey)
                .build();

        long started = System.nanoTime();
        SelfHostedTranslateResponse response;
        try {
            log.debug("Calling self-hosted provider - source: {}, target: {}, texts: {}",
                    first.getSourceLang(), first.getTargetLang(), texts.size());
            response = restClient.post()
                    .uri("/translate")
                    .body(request)
                    .retrieve()
                    .body(SelfHostedTranslateResponse.class);
        } catch (RestClientException e) {
            throw ProviderErrorClassifier.classify(ID, e);
        }
        long latencyMs = (System.nanoTime() - started) / 1_000_000L;

        if (response == null || response.getTranslatedText() == null
                || response.getTranslatedText().size() != texts.size()) {
            throw ProviderException.transientError(ID, "MALFORMED_RESPONSE",
                    "Self-hosted provider returned an unexpected number of translations");
        }

        List<SelfHostedTranslateResponse.DetectedLanguage> detected = response.getDetectedLanguage();
        for (int i = 0; i < positions.size(); i++) {
            String detectedSource = null;
            if (first.isAutoDetect() && detected != null && detected.size() > i && detected.get(i) != null) {
                detectedSource = detected.get(i).getLanguage();
            }
            results[positions.get(i)] = ProviderResult.builder()
                    .text(response.getTranslatedText().get(i))
                    .detectedSource(detectedSource)
                    .providerId(ID)
                    .latencyMs(latencyMs)
                    .build();
        }
    }

    private static double toUnitInterval(Double percentage) {
        if (percentage == null) {
            return 0.0;
        }
        return percentage / 100.0;
    }

    private static SimpleClientHttpRequestFactory requestFactory(int timeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return factory;
    }
}
