package com.polyglot.translationGateway.translation.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polyglot.translationGateway.language.model.LanguageDetectionResult;
import com.polyglot.translationGateway.translation.dto.ChatCompletionRequest;
import com.polyglot.translationGateway.translation.dto.ChatCompletionResponse;
import com.polyglot.translationGateway.translation.dto.CloudTranslationItem;
import com.polyglot.translationGateway.translation.exception.ProviderException;
import com.polyglot.translationGateway.translation.model.BatchOptions;
import com.polyglot.translationGateway.translation.model.ProviderResult;
import com.polyglot.translationGateway.translation.model.TranslationUnit;
import com.polyglot.translationGateway.translation.prompt.TranslationSystemPrompt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Cloud provider calling an OpenAI-compatible chat completions endpoint (Groq by default).
 * 
 * Units are sent as a JSON array in the user message and come back as a JSON array keyed
 * by item id. Batches larger than {@code cloud.api.max-batch-size} are split into several calls.
 * A requested glossary is resolved through {@link GlossaryCatalog} and listed in the system prompt.
 */
@Slf4j
@Service
public class CloudTranslationProvider implements TranslationProvider {

    public static final String ID = "cloud";

    private static final String DEFAULT_URL = "https://api.groq.com/openai/v1/chat/completions";
    private static final String DEFAULT_MODEL = "llama-3.3-70b-versatile";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final GlossaryCatalog glossaryCatalog;
    private final String apiKey;
    private final String model;
    private final double temperature;
    private final int maxBatchSize;

    @Autowired
    public CloudTranslationProvider(
            ObjectMapper objectMapper,
            GlossaryCatalog glossaryCatalog,
            @Value("${cloud.api.url:" + DEFAULT_URL + "}") String url,
            @Value("${cloud.api.key:}") String apiKey,
            @Value("${cloud.api.model:" + DEFAULT_MODEL + "}") String model,
            @Value("${cloud.api.temperature:0.2}") double temperature,
            @Value("${cloud.api.max-batch-size:40}") int maxBatchSize,
            @Value("${cloud.api.timeout-ms:15000}") int timeoutMs) {
        this(RestClient.builder()
                        .baseUrl(url)
                        .requestFactory(requestFactory(timeoutMs))
                        .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                        .build(),
                objectMapper, glossaryCatalog, apiKey, model, temperature, maxBatchSize);
    }

    CloudTranslationProvider(RestClient restClient, ObjectMapper objectMapper, GlossaryCatalog glossaryCatalog,
                             String apiKey, String model, double temperature, int maxBatchSize) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.glossaryCatalog = glossaryCatalog;
        this.apiKey = apiKey;
        this.model = model;
        this.temperature = temperature;
        this.maxBatchSize = Math.max(1, maxBatchSize);
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<ProviderResult> translateBatch(List<TranslationUnit> units, BatchOptions options) {
        requireConfigured();
        String systemPrompt = TranslationSystemPrompt.getBatchTranslationPrompt(
                options.getFormality(), options.isPreserveEntities(), glossaryTerms(options.getGlossaryId(), units));

        List<ProviderResult> results = new ArrayList<>(units.size());
        for (int from = 0; from < units.size(); from += maxBatchSize) {
            List<TranslationUnit> chunk = units.subList(from, Math.min(units.size(), from + maxBatchSize));
            results.addAll(translateChunk(chunk, systemPrompt));
        }
        return results;
    }

    @Override
    public LanguageDetectionResult detect(String text) {
        requireConfigured();
        String content = complete(TranslationSystemPrompt.getDetectionPrompt(), text);
        try {
            JsonNode node = objectMapper.readTree(stripFences(content));
            String language = node.path("language").asText(null);
            if (language == null || language.isBlank()) {
                throw ProviderException.transientError(ID, "MALFORMED_RESPONSE", "Cloud detection returned no language");
            }
            return LanguageDetectionResult.builder()
                    .languageCode(language)
                    .confidence(node.path("confidence").asDouble(0.0))
                    .build()
                    .clamped();
        } catch (JsonProcessingException e) {
            throw ProviderException.transientError(ID, "MALFORMED_RESPONSE", "Cloud detection response is not JSON", e);
        }
    }

    private Map<String, Map<String, Map<String, String>>> glossaryTerms(String glossaryId, List<TranslationUnit> units) {
        if (glossaryId == null) {
            return Map.of();
        }
        Map<String, Map<String, Map<String, String>>> glossary = glossaryCatalog.find(glossaryId)
                .orElseThrow(() -> ProviderException.permanent(ID, "UNKNOWN_GLOSSARY", "Glossary not found: " + glossaryId));
        Set<String> targets = units.stream()
                .map(unit -> unit.getTargetLang().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        return GlossaryCatalog.forTargets(glossary, targets);
    }

    private List<ProviderResult> translateChunk(List<TranslationUnit> chunk, String systemPrompt) {
        long started = System.nanoTime();
        List<CloudTranslationItem> items = new ArrayList<>(chunk.size());
        for (int i = 0; i < chunk.size(); i++) {
            TranslationUnit unit = chunk.get(i);
            items.add(CloudTranslationItem.builder()
                    .id(i)
                    .text(unit.getText())
                    .source(unit.getSourceLang())
                    .target(unit.getTargetLang())
                    .format(unit.getFormat().wireValue())
                    .build());
        }

        String userMessage;
        try {
            userMessage = objectMapper.writeValueAsString(items);
        } catch (JsonProcessingException e) {
            throw ProviderException.permanent(ID, "SERIALIZATION", "Cannot serialize cloud request", e);
        }

        String content = complete(systemPrompt, userMessage);
        Map<Integer, CloudTranslationItem> byId = parseItems(content, chunk.size());
        long latencyMs = (System.nanoTime() - started) / 1_000_000L;

        List<ProviderResult> results = new ArrayList<>(chunk.size());
        for (int i = 0; i < chunk.size(); i++) {
            CloudTranslationItem item = byId.get(i);
            if (item == null || item.getText() == null) {
                throw ProviderException.transientError(ID, "MALFORMED_RESPONSE", "Cloud response is missing item " + i);
            }
            results.add(ProviderResult.builder()
                    .text(item.getText())
                    .detectedSource(chunk.get(i).isAutoDetect() ? item.getDetectedSource() : null)
                    .providerId(ID)
                    .latencyMs(latencyMs)
                    .build());
        }
        return results;
    }

    private Map<Integer, CloudTranslationItem> parseItems(String content, int expected) {
        List<CloudTranslationItem> parsed;
        try {
            parsed = objectMapper.readValue(stripFences(content), new TypeReference<List<CloudTranslationItem>>() {
            });
        } catch (JsonProcessingException e) {
            throw ProviderException.transientError(ID, "MALFORMED_RESPONSE", "Cloud response is not a JSON array", e);
        }
        if (parsed == null || parsed.size() != expected) {
            throw ProviderException.transientError(ID, "MALFORMED_RESPONSE",
                    "Cloud response has " + (parsed == null ? 0 : parsed.size()) + " items, expected " + expected);
        }
        Map<Integer, CloudTranslationItem> byId = new HashMap<>();
        for (CloudTranslationItem item : parsed) {
            if (item.getId() != null) {
                byId.put(item.getId(), item);
            }
        }
        return byId;
    }

    private String complete(String systemPrompt, String userMessage) {
        ChatCompletionRequest request = ChatCompletionRequest.builder()
                .messages(List.of(
                        ChatCompletionRequest.Message.builder()
                                .role("system")
                                .content(systemPrompt)
                                .build(),
                        ChatCompletionRequest.Message.builder()
                                .role("user")
                                .content(userMessage)
                                .build()
                ))
                .model(model)
                .temperature(temperature)
                .topP(1.0)
                .stream(false)
                .build();

        ChatCompletionResponse response;
        try {
            log.debug("Calling cloud provider - model: {}, message length: {}", model, userMessage.length());
            response = restClient.post()
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .body(request)
                    .retrieve()
                    .body(ChatCompletionResponse.class);
        } catch (RestClientException e) {
            throw ProviderErrorClassifier.classify(ID, e);
        }

        String content = response == null ? null : response.getContent();
        if (content == null || content.isBlank()) {
            throw ProviderException.transientError(ID, "EMPTY_RESPONSE", "Cloud provider returned no content");
        }
        log.debug("Cloud provider response received - model: {}, tokens used: {}",
                response.getModel(),
                response.getUsage() != null ? response.getUsage().getTotalTokens() : "unknown");
        return content;
    }

    private void requireConfigured() {
        if (apiKey == null || apiKey.isBlank()) {
            throw ProviderException.permanent(ID, "NOT_CONFIGURED", "Cloud API key is not configured. Set cloud.api.key");
        }
    }

    private static String stripFences(String content) {
        String trimmed = content.strip();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int closing = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && closing > firstNewline) {
                return trimmed.substring(firstNewline + 1, closing).strip();
            }
        }
        return trimmed;
    }

    private static SimpleClientHttpRequestFactory requestFactory(int timeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return factory;
    }
}
