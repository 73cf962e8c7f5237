package com.polyglot.translationGateway.gateway.service;

import com.polyglot.translationGateway.auth.model.Identity;
import com.polyglot.translationGateway.auth.service.Authenticator;
import com.polyglot.translationGateway.config.GatewayProperties;
import com.polyglot.translationGateway.gateway.dto.CacheStatsResponse;
import com.polyglot.translationGateway.gateway.dto.DetectRequest;
import com.polyglot.translationGateway.gateway.dto.DetectResponse;
import com.polyglot.translationGateway.gateway.dto.TranslateRequest;
import com.polyglot.translationGateway.gateway.dto.TranslateResponse;
import com.polyglot.translationGateway.gateway.exception.RateLimitExceededException;
import com.polyglot.translationGateway.gateway.exception.UnauthorizedException;
import com.polyglot.translationGateway.gateway.exception.ValidationException;
import com.polyglot.translationGateway.gateway.model.RateLimitDecision;
import com.polyglot.translationGateway.gateway.model.RequestContext;
import com.polyglot.translationGateway.language.model.LanguageDetectionResult;
import com.polyglot.translationGateway.language.service.LanguageCatalog;
import com.polyglot.translationGateway.language.service.LanguageDetectionService;
import com.polyglot.translationGateway.support.MutableClock;
import com.polyglot.translationGateway.translation.cache.CacheStatsSnapshot;
import com.polyglot.translationGateway.translation.cache.TranslationMemory;
import com.polyglot.translationGateway.translation.model.BatchOptions;
import com.polyglot.translationGateway.translation.model.BatchRequest;
import com.polyglot.translationGateway.translation.model.BatchResult;
import com.polyglot.translationGateway.translation.model.TextFormat;
import com.polyglot.translationGateway.translation.model.TranslationUnit;
import com.polyglot.translationGateway.translation.model.UnitOutcome;
import com.polyglot.translationGateway.translation.service.BatchCoordinator;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("GatewayService should gate, validate and map translation requests")
class GatewayServiceTest {

    private static final String AUTH = "Bearer key-123";
    private static final Identity ALICE = new Identity("alice", "fp");

    private Authenticator authenticator;
    private RateLimiter rateLimiter;
    private BatchCoordinator batchCoordinator;
    private LanguageDetectionService languageDetectionService;
    private TranslationMemory translationMemory;
    private GatewayProperties properties;
    private GatewayService service;

    @BeforeEach
    void setUp() {
        authenticator = mock(Authenticator.class);
        rateLimiter = mock(RateLimiter.class);
        batchCoordinator = mock(BatchCoordinator.class);
        languageDetectionService = mock(LanguageDetectionService.class);
        translationMemory = mock(TranslationMemory.class);
        properties = new GatewayProperties();
        properties.setMaxTextsPerRequest(3);

        service = new GatewayService(
                new CorrelationIdService(),
                authenticator,
                rateLimiter,
                batchCoordinator,
                languageDetectionService,
                mock(LanguageCatalog.class),
                translationMemory,
                properties,
                Validation.buildDefaultValidatorFactory().getValidator(),
                MutableClock.startingAt("2026-05-05T10:00:00Z"));

        when(authenticator.authenticate(AUTH, "corr-1")).thenReturn(ALICE);
        when(rateLimiter.admit(ALICE)).thenReturn(RateLimitDecision.admitted(41));
    }

    private static TranslateRequest request(String target, String... texts) {
        return TranslateRequest.builder()
                .texts(new ArrayList<>(Arrays.asList(texts)))
                .target(target)
                .build();
    }

    private BatchRequest capturedBatch() {
        ArgumentCaptor<BatchRequest> captor = ArgumentCaptor.forClass(BatchRequest.class);
        verify(batchCoordinator).translate(captor.capture());
        return captor.getValue();
    }

    @Test
    void admitBuildsContext() {
        RequestContext context = service.admit(AUTH, "corr-1");

        assertThat(context.getIdentity()).isEqualTo(ALICE);
        assertThat(context.getCorrelationId()).isEqualTo("corr-1");
        assertThat(context.getRemainingRequests()).isEqualTo(41);
        assertThat(context.getReceivedAt()).hasToString("2026-05-05T10:00:00Z");
    }

    @Test
    void admitGeneratesCorrelationIdWhenMissing() {
        when(authenticator.authenticate(anyString(), anyString())).thenReturn(ALICE);

        assertThat(service.admit(AUTH, null).getCorrelationId()).isNotBlank();
    }

    @Test
    void rejectionCarriesRetryAfter() {
        when(rateLimiter.admit(ALICE)).thenReturn(RateLimitDecision.rejected(1_500));

        RateLimitExceededException exception = catchThrowableOfType(
                () -> service.translate(request("es", "Hello"), AUTH, "corr-1"), RateLimitExceededException.class);

        assertThat(exception.getRetryAfterMs()).isEqualTo(1_500);
        assertThat(exception.getRetryAfterSeconds()).isEqualTo(2);
        verifyNoInteractions(batchCoordinator);
    }

    @Test
    void authenticationRunsBeforeValidation() {
        when(authenticator.authenticate(null, "corr-1")).thenThrow(new UnauthorizedException("missing"));

        assertThatThrownBy(() -> service.translate(request("", (String) null), null, "corr-1"))
                .isInstanceOf(UnauthorizedException.class);
        verify(rateLimiter, never()).admit(any());
    }

    @Test
    void buildsUnitsInRequestOrder() {
        when(batchCoordinator.translate(any())).thenReturn(BatchResult.builder()
                .outcomes(List.of(
                        UnitOutcome.success(0, "¡Hola!", "en", "on-device", false),
                        UnitOutcome.success(1, "Gracias", "en", "on-device", true)))
                .build());

        TranslateResponse response = service.translate(request(" es ", "Hello", "Thank you"), AUTH, "corr-1");

        BatchRequest batch = capturedBatch();
        assertThat(batch.getCorrelationId()).isEqualTo("corr-1");
        assertThat(batch.getOptions()).isSameAs(BatchOptions.NONE);
        assertThat(batch.getUnits()).extracting(TranslationUnit::getText).containsExactly("Hello", "Thank you");
        assertThat(batch.getUnits()).allSatisfy(unit -> {
            assertThat(unit.getTargetLang()).isEqualTo("es");
            assertThat(unit.isAutoDetect()).isTrue();
            assertThat(unit.getFormat()).isEqualTo(TextFormat.TEXT);
        });
        assertThat(response.getCorrelationId()).isEqualTo("corr-1");
        assertThat(response.getTranslations()).extracting("text").containsExactly("¡Hola!", "Gracias");
    }

    @Test
    void passesGlossaryAndOptions() {
        when(batchCoordinator.translate(any())).thenReturn(BatchResult.builder()
                .outcomes(List.of(UnitOutcome.success(0, "<b>Guardar cambios</b>", null, "on-device", false)))
                .build());
        TranslateRequest request = request("es", "<b>Save</b>");
        request.setSource("en");
        request.setFormat("HTML");
        request.setGlossaryId("ui-terms");
        request.setOptions(new TranslateRequest.Options("formal", true));

        service.translate(request, AUTH, "corr-1");

        BatchRequest batch = capturedBatch();
        assertThat(batch.getOptions().getGlossaryId()).isEqualTo("ui-terms");
        assertThat(batch.getOptions().getFormality()).isEqualTo("formal");
        assertThat(batch.getOptions().isPreserveEntities()).isTrue();
        assertThat(batch.getUnits().get(0).getSourceLang()).isEqualTo("en");
        assertThat(batch.getUnits().get(0).getFormat()).isEqualTo(TextFormat.HTML);
    }

    @Test
    void keepsEmptyTextsAsUnits() {
        when(batchCoordinator.translate(any())).thenReturn(BatchResult.builder()
                .outcomes(List.of(UnitOutcome.success(0, "", null, "on-device", false)))
                .build());

        service.translate(request("es", ""), AUTH, "corr-1");

        assertThat(capturedBatch().getUnits()).extracting(TranslationUnit::getText).containsExactly("");
    }

    @Test
    void rejectsMissingBody() {
        ValidationException exception = catchThrowableOfType(
                () -> service.translate(null, AUTH, "corr-1"), ValidationException.class);

        assertThat(exception.getField()).isEqualTo("body");
    }

    @Test
    void rejectsBlankTarget() {
        ValidationException exception = catchThrowableOfType(
                () -> service.translate(request(" ", "Hello"), AUTH, "corr-1"), ValidationException.class);

        assertThat(exception.getField()).isEqualTo("target");
        assertThat(exception.getReason()).isEqualTo("must not be blank");
    }

    @Test
    void rejectsEmptyTextList() {
        ValidationException exception = catchThrowableOfType(
                () -> service.translate(request("es"), AUTH, "corr-1"), ValidationException.class);

        assertThat(exception.getField()).isEqualTo("texts");
    }

    @Test
    void rejectsTooManyTexts() {
        ValidationException exception = catchThrowableOfType(
                () -> service.translate(request("es", "a", "b", "c", "d"), AUTH, "corr-1"), ValidationException.class);

        assertThat(exception.getReason()).isEqualTo("must contain at most 3 texts");
    }

    @Test
    void rejectsNullTextWithItsIndex() {
        ValidationException exception = catchThrowableOfType(
                () -> service.translate(request("es", "a", null), AUTH, "corr-1"), ValidationException.class);

        assertThat(exception.getField()).isEqualTo("texts[1]");
    }

    @Test
    void rejectsUnknownFormat() {
        TranslateRequest request = request("es", "Hello");
        request.setFormat("markdown");

        ValidationException exception = catchThrowableOfType(
                () -> service.translate(request, AUTH, "corr-1"), ValidationException.class);

        assertThat(exception.getField()).isEqualTo("format");
        verifyNoInteractions(batchCoordinator);
    }

    @Test
    void detectDelegatesToDetectionService() {
        when(languageDetectionService.detect("Bonjour", "corr-1")).thenReturn(new LanguageDetectionResult("fr", 0.9));

        DetectResponse response = service.detect(new DetectRequest("Bonjour"), AUTH, "corr-1");

        assertThat(response.getLanguage()).isEqualTo("fr");
        assertThat(response.getConfidence()).isEqualTo(0.9);
    }

    @Test
    void detectRejectsBlankText() {
        ValidationException exception = catchThrowableOfType(
                () -> service.detect(new DetectRequest(""), AUTH, "corr-1"), ValidationException.class);

        assertThat(exception.getField()).isEqualTo("text");
        verifyNoInteractions(languageDetectionService);
    }

    @Test
    void cacheStatsAreMappedFromMemory() {
        when(translationMemory.stats()).thenReturn(CacheStatsSnapshot.builder()
                .size(4).hitCount(10).missCount(3).evictionCount(1).build());

        CacheStatsResponse stats = service.cacheStats(AUTH, "corr-1");

        assertThat(stats.getSize()).isEqualTo(4);
        assertThat(stats.getHitCount()).isEqualTo(10);
        assertThat(stats.getMissCount()).isEqualTo(3);
        assertThat(stats.getEvictionCount()).isEqualTo(1);
    }
}
