package com.polyglot.translationGateway.gateway.service;

import com.polyglot.translationGateway.auth.model.Identity;
import com.polyglot.translationGateway.auth.service.Authenticator;
import com.polyglot.translationGateway.config.GatewayProperties;
import com.polyglot.translationGateway.gateway.dto.CacheStatsResponse;
import com.polyglot.translationGateway.gateway.dto.DetectRequest;
import com.polyglot.translationGateway.gateway.dto.DetectResponse;
import com.polyglot.translationGateway.gateway.dto.TranslateRequest;
import com.polyglot.translationGateway.gateway.dto.TranslateResponse;
import com.polyglot.translationGateway.gateway.dto.TranslationItem;
import com.polyglot.translationGateway.gateway.exception.RateLimitExceededException;
import com.polyglot.translationGateway.gateway.exception.ValidationException;
import com.polyglot.translationGateway.gateway.model.RateLimitDecision;
import com.polyglot.translationGateway.gateway.model.RequestContext;
import com.polyglot.translationGateway.gateway.util.IdentityMasker;
import com.polyglot.translationGateway.language.model.LanguageDetectionResult;
import com.polyglot.translationGateway.language.model.LanguageInfo;
import com.polyglot.translationGateway.language.service.LanguageCatalog;
import com.polyglot.translationGateway.language.service.LanguageDetectionService;
import com.polyglot.translationGateway.translation.cache.CacheStatsSnapshot;
import com.polyglot.translationGateway.translation.cache.TranslationMemory;
import com.polyglot.translationGateway.translation.model.BatchOptions;
import com.polyglot.translationGateway.translation.model.BatchRequest;
import com.polyglot.translationGateway.translation.model.BatchResult;
import com.polyglot.translationGateway.translation.model.TextFormat;
import com.polyglot.translationGateway.translation.model.TranslationUnit;
import com.polyglot.translationGateway.translation.model.UnitOutcome;
import com.polyglot.translationGateway.translation.service.BatchCoordinator;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;

/**
 * Gateway service - handles all business logic for the gateway.
 *
 * Responsibilities:
 * - Authenticate the bearer credential
 * - Enforce rate limiting per identity
 * - Validate the request
 * - Turn texts into translation units and hand them to the Batch Coordinator
 * - Map results back to the wire format
 *
 * Auth and rate limiting run before validation, so malformed requests from
 * unknown callers are rejected as unauthenticated.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GatewayService {

    private final CorrelationIdService correlationIdService;
    private final Authenticator authenticator;
    private final RateLimiter rateLimiter;
    private final BatchCoordinator batchCoordinator;
    private final LanguageDetectionService languageDetectionService;
    private final LanguageCatalog languageCatalog;
    private final TranslationMemory translationMemory;
    private final GatewayProperties properties;
    private final Validator validator;
    private final Clock clock;

    /**
     * Passes the request through authentication and rate limiting.
     *
     * @param authorizationHeader raw {@code Authorization} header
     * @param correlationId       correlation id set by the filter, generated if null
     * @return context of the admitted request
     * @throws RateLimitExceededException if the caller's window is exhausted
     */
    public RequestContext admit(String authorizationHeader, String correlationId) {
        String resolvedCorrelationId = correlationId != null ? correlationId : correlationIdService.generateCorrelationId();

        Identity identity = authenticator.authenticate(authorizationHeader, resolvedCorrelationId);

        RateLimitDecision decision = rateLimiter.admit(identity);
        if (!decision.isAllowed()) {
            log.warn("Rate limit exceeded - correlationId: {}, subject: {}",
                    resolvedCorrelationId, IdentityMasker.mask(identity.getSubjectId()));
            throw new RateLimitExceededException(
                    "Rate limit exceeded. Please try again later.", decision.getRetryAfterMs());
        }

        return RequestContext.builder()
                .identity(identity)
                .correlationId(resolvedCorrelationId)
                .remainingRequests(decision.getRemaining())
                .receivedAt(clock.instant())
                .build();
    }

    /**
     * Translates a batch of texts.
     *
     * @throws ValidationException for malformed requests
     * @throws com.polyglot.translationGateway.translation.exception.PartialFailureException if some texts failed
     * @throws com.polyglot.translationGateway.translation.exception.TotalFailureException if every text failed
     */
    public TranslateResponse translate(TranslateRequest request, String authorizationHeader, String correlationId) {
        RequestContext context = admit(authorizationHeader, correlationId);
        BatchRequest batch = toBatchRequest(request, context.getCorrelationId());

        log.info("Translate request received - correlationId: {}, subject: {}, texts: {}, target: {}",
                context.getCorrelationId(), IdentityMasker.mask(context.getIdentity().getSubjectId()),
                batch.size(), request.getTarget());

        BatchResult result = batchCoordinator.translate(batch);

        return TranslateResponse.builder()
                .translations(toItems(result.getOutcomes()))
                .correlationId(context.getCorrelationId())
                .build();
    }

    public DetectResponse detect(DetectRequest request, String authorizationHeader, String correlationId) {
        RequestContext context = admit(authorizationHeader, correlationId);
        validate(request);

        LanguageDetectionResult result = languageDetectionService.detect(request.getText(), context.getCorrelationId());
        log.info("Detect request served - correlationId: {}, language: {}", context.getCorrelationId(), result.getLanguageCode());
        return DetectResponse.builder()
                .language(result.getLanguageCode())
                .confidence(result.getConfidence())
                .build();
    }

    public List<LanguageInfo> languages() {
        return languageCatalog.listLanguages();
    }

    public CacheStatsResponse cacheStats(String authorizationHeader, String correlationId) {
        admit(authorizationHeader, correlationId);
        CacheStatsSnapshot stats = translationMemory.stats();
        return CacheStatsResponse.builder()
                .size(stats.getSize())
                .hitCount(stats.getHitCount())
                .missCount(stats.getMissCount())
                .evictionCount(stats.getEvictionCount())
                .build();
    }

    /**
     * Runs bean validation and reports the first violation, ordered by property path.
     */
    public void validate(Object request) {
        if (request == null) {
            throw new ValidationException("body", "must not be empty");
        }
        validator.validate(request).stream()
                .min(Comparator.comparing((ConstraintViolation<Object> v) -> v.getPropertyPath().toString()))
                .ifPresent(violation -> {
                    throw new ValidationException(violation.getPropertyPath().toString(), violation.getMessage());
                });
    }

    private BatchRequest toBatchRequest(TranslateRequest request, String correlationId) {
        validate(request);

        List<String> texts = request.getTexts();
        if (texts == null || texts.isEmpty()) {
            throw new ValidationException("texts", "must contain at least one text");
        }
        int maxTexts = properties.getMaxTextsPerRequest();
        if (texts.size() > maxTexts) {
            throw new ValidationException("texts", "must contain at most " + maxTexts + " texts");
        }
        for (int i = 0; i < texts.size(); i++) {
            if (texts.get(i) == null) {
                throw new ValidationException("texts[" + i + "]", "must not be null");
            }
        }

        TextFormat format = TextFormat.fromWireValue(request.getFormat());
        if (format == null) {
            throw new ValidationException("format", "must be one of: text, html");
        }

        String source = request.getSource() == null || request.getSource().isBlank()
                ? TranslationUnit.AUTO
                : request.getSource().trim();
        String target = request.getTarget().trim();

        BatchRequest.BatchRequestBuilder batch = BatchRequest.builder()
                .options(toOptions(request))
                .correlationId(correlationId);
        for (String text : texts) {
            batch.unit(TranslationUnit.builder()
                    .text(text)
                    .sourceLang(source)
                    .targetLang(target)
                    .format(format)
                    .build());
        }
        return batch.build();
    }

    private static BatchOptions toOptions(TranslateRequest request) {
        TranslateRequest.Options options = request.getOptions();
        String glossaryId = request.getGlossaryId() == null || request.getGlossaryId().isBlank()
                ? null
                : request.getGlossaryId();
        if (options == null && glossaryId == null) {
            return BatchOptions.NONE;
        }
        return BatchOptions.builder()
                .glossaryId(glossaryId)
                .formality(options == null ? null : options.getFormality())
                .preserveEntities(options != null && Boolean.TRUE.equals(options.getPreserveEntities()))
                .build();
    }

    /**
     * Maps outcomes to wire items, index-aligned; failed units become null.
     */
    public static List<TranslationItem> toItems(List<UnitOutcome> outcomes) {
        return outcomes.stream()
                .map(outcome -> outcome.isSuccess()
                        ? TranslationItem.builder()
                                .text(outcome.getText())
                                .detectedSource(outcome.getDetectedSource())
                                .build()
                        : null)
                .toList();
    }
}
