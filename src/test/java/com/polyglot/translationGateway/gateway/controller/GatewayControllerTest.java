package com.polyglot.translationGateway.gateway.controller;

import com.polyglot.translationGateway.gateway.dto.TranslateResponse;
import com.polyglot.translationGateway.gateway.dto.TranslationItem;
import com.polyglot.translationGateway.gateway.exception.ForbiddenException;
import com.polyglot.translationGateway.gateway.exception.RateLimitExceededException;
import com.polyglot.translationGateway.gateway.exception.SpeechNotConfiguredException;
import com.polyglot.translationGateway.gateway.exception.UnauthorizedException;
import com.polyglot.translationGateway.gateway.exception.ValidationException;
import com.polyglot.translationGateway.gateway.filter.CorrelationIdFilter;
import com.polyglot.translationGateway.gateway.model.RequestContext;
import com.polyglot.translationGateway.gateway.service.CorrelationIdService;
import com.polyglot.translationGateway.gateway.service.GatewayService;
import com.polyglot.translationGateway.language.model.LanguageInfo;
import com.polyglot.translationGateway.speech.model.SynthesisResult;
import com.polyglot.translationGateway.speech.model.TranscriptionResult;
import com.polyglot.translationGateway.speech.service.SpeechDispatcher;
import com.polyglot.translationGateway.translation.exception.PartialFailureException;
import com.polyglot.translationGateway.translation.exception.RequestTimeoutException;
import com.polyglot.translationGateway.translation.exception.TotalFailureException;
import com.polyglot.translationGateway.translation.model.UnitFailure;
import com.polyglot.translationGateway.translation.model.UnitOutcome;
import com.polyglot.translationGateway.translation.provider.ProviderErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.emptyOrNullString;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("Gateway HTTP surface should map outcomes to status codes")
class GatewayControllerTest {

    private static final String AUTH = "Bearer key-123";
    private static final String BODY = "{\"texts\":[\"Hello\",\"Goodbye\"],\"target\":\"es\"}";

    private GatewayService gatewayService;
    private SpeechDispatcher speechDispatcher;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        gatewayService = mock(GatewayService.class);
        speechDispatcher = mock(SpeechDispatcher.class);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new GatewayController(gatewayService), new SpeechController(gatewayService, speechDispatcher))
                .setControllerAdvice(new GlobalExceptionHandler())
                .addFilters(new CorrelationIdFilter(new CorrelationIdService()))
                .build();
    }

    private static UnitFailure failure(int index, ProviderErrorKind kind, String reason) {
        return UnitFailure.builder().index(index).kind(kind).reason(reason).message(reason).build();
    }

    @Test
    void translateReturnsOrderedItemsAndEchoesCorrelationId() throws Exception {
        when(gatewayService.translate(any(), eq(AUTH), eq("client-42"))).thenReturn(TranslateResponse.builder()
                .translations(List.of(
                        TranslationItem.builder().text("¡Hola!").detectedSource("en").build(),
                        TranslationItem.builder().text("Adiós").build()))
                .correlationId("client-42")
                .build());

        mockMvc.perform(post("/api/v1/translate")
                        .header(HttpHeaders.AUTHORIZATION, AUTH)
                        .header(CorrelationIdService.HEADER, "client-42")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isOk())
                .andExpect(header().string(CorrelationIdService.HEADER, "client-42"))
                .andExpect(jsonPath("$.translations", hasSize(2)))
                .andExpect(jsonPath("$.translations[0].text").value("¡Hola!"))
                .andExpect(jsonPath("$.translations[0].detected_source").value("en"))
                .andExpect(jsonPath("$.translations[1].detected_source").doesNotExist())
                .andExpect(jsonPath("$.correlation_id").value("client-42"));
    }

    @Test
    void generatesCorrelationIdWhenClientSendsUnusableOne() throws Exception {
        when(gatewayService.translate(any(), any(), anyString())).thenReturn(TranslateResponse.builder()
                .translations(List.of()).build());

        mockMvc.perform(post("/api/v1/translate")
                        .header(HttpHeaders.AUTHORIZATION, AUTH)
                        .header(CorrelationIdService.HEADER, "bad id\nwith newline")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isOk())
                .andExpect(header().string(CorrelationIdService.HEADER, not(emptyOrNullString())))
                .andExpect(header().string(CorrelationIdService.HEADER, not("bad id\nwith newline")));
    }

    @Test
    void missingCredentialIs401() throws Exception {
        when(gatewayService.translate(any(), isNull(), anyString())).thenThrow(new UnauthorizedException("Missing or malformed bearer token"));

        mockMvc.perform(post("/api/v1/translate").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, "Bearer"))
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
    }

    @Test
    void rejectedCredentialIs403() throws Exception {
        when(gatewayService.translate(any(), eq(AUTH), anyString())).thenThrow(new ForbiddenException("Credential not accepted"));

        mockMvc.perform(post("/api/v1/translate")
                        .header(HttpHeaders.AUTHORIZATION, AUTH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));
    }

    @Test
    void rateLimitedIs429WithRetryAfter() throws Exception {
        when(gatewayService.translate(any(), eq(AUTH), anyString()))
                .thenThrow(new RateLimitExceededException("Rate limit exceeded. Please try again later.", 12_300));

        mockMvc.perform(post("/api/v1/translate")
                        .header(HttpHeaders.AUTHORIZATION, AUTH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string(HttpHeaders.RETRY_AFTER, "13"))
                .andExpect(jsonPath("$.code").value("RATE_LIMIT_EXCEEDED"))
                .andExpect(jsonPath("$.retry_after_ms").value(12_300));
    }

    @Test
    void validationErrorNamesTheField() throws Exception {
        when(gatewayService.translate(any(), eq(AUTH), anyString()))
                .thenThrow(new ValidationException("target", "must not be blank"));

        mockMvc.perform(post("/api/v1/translate")
                        .header(HttpHeaders.AUTHORIZATION, AUTH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"texts\":[\"Hello\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.field").value("target"))
                .andExpect(jsonPath("$.reason").value("must not be blank"));
    }

    @Test
    void malformedJsonIs400() throws Exception {
        mockMvc.perform(post("/api/v1/translate")
                        .header(HttpHeaders.AUTHORIZATION, AUTH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"texts\": [oops"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("body"));
    }

    @Test
    void partialFailureKeepsPositions() throws Exception {
        when(gatewayService.translate(any(), eq(AUTH), anyString())).thenThrow(new PartialFailureException(List.of(
                UnitOutcome.success(0, "¡Hola!", null, "on-device", false),
                UnitOutcome.failed(failure(1, ProviderErrorKind.PERMANENT, "UNSUPPORTED_LANGUAGE_PAIR")))));

        mockMvc.perform(post("/api/v1/translate")
                        .header(HttpHeaders.AUTHORIZATION, AUTH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("PARTIAL_FAILURE"))
                .andExpect(jsonPath("$.translations", hasSize(2)))
                .andExpect(jsonPath("$.translations[0].text").value("¡Hola!"))
                .andExpect(jsonPath("$.translations[1]").value(nullValue()))
                .andExpect(jsonPath("$.failures[0].index").value(1))
                .andExpect(jsonPath("$.failures[0].kind").value("permanent"))
                .andExpect(jsonPath("$.failures[0].retryable").value(false))
                .andExpect(jsonPath("$.failures[0].reason").value("UNSUPPORTED_LANGUAGE_PAIR"));
    }

    @Test
    void permanentTotalFailureIs422() throws Exception {
        when(gatewayService.translate(any(), eq(AUTH), anyString())).thenThrow(new TotalFailureException(List.of(
                failure(0, ProviderErrorKind.PERMANENT, "UNSUPPORTED_LANGUAGE_PAIR"),
                failure(1, ProviderErrorKind.PERMANENT, "UNSUPPORTED_LANGUAGE_PAIR"))));

        mockMvc.perform(post("/api/v1/translate")
                        .header(HttpHeaders.AUTHORIZATION, AUTH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("TOTAL_FAILURE"))
                .andExpect(jsonPath("$.failures", hasSize(2)))
                .andExpect(jsonPath("$.translations").doesNotExist());
    }

    @Test
    void retryableTotalFailureIs502() throws Exception {
        when(gatewayService.translate(any(), eq(AUTH), anyString())).thenThrow(new TotalFailureException(List.of(
                failure(0, ProviderErrorKind.TRANSIENT, "UPSTREAM_503"))));

        mockMvc.perform(post("/api/v1/translate")
                        .header(HttpHeaders.AUTHORIZATION, AUTH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.failures[0].retryable").value(true));
    }

    @Test
    void timeoutIs504() throws Exception {
        when(gatewayService.translate(any(), eq(AUTH), anyString()))
                .thenThrow(new RequestTimeoutException("Provider dispatch exceeded 30000 ms"));

        mockMvc.perform(post("/api/v1/translate")
                        .header(HttpHeaders.AUTHORIZATION, AUTH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.code").value("REQUEST_TIMEOUT"));
    }

    @Test
    void unexpectedErrorIs500WithoutDetails() throws Exception {
        when(gatewayService.translate(any(), eq(AUTH), anyString())).thenThrow(new IllegalStateException("secret detail"));

        mockMvc.perform(post("/api/v1/translate")
                        .header(HttpHeaders.AUTHORIZATION, AUTH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.message").value("An unexpected error occurred"));
    }

    @Test
    void languagesArePublic() throws Exception {
        when(gatewayService.languages()).thenReturn(List.of(new LanguageInfo("he", "Hebrew", "rtl", true)));

        mockMvc.perform(get("/api/v1/languages"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].code").value("he"))
                .andExpect(jsonPath("$[0].direction").value("rtl"))
                .andExpect(jsonPath("$[0].supports_transliteration").value(true));
    }

    @Test
    void transcriptionWithoutEngineIs501() throws Exception {
        RequestContext context = RequestContext.builder().correlationId("c").build();
        when(gatewayService.admit(eq(AUTH), anyString())).thenReturn(context);
        when(speechDispatcher.transcribe(eq(context), any(), eq("en")))
                .thenThrow(new SpeechNotConfiguredException("Speech-to-text is not configured"));

        mockMvc.perform(multipart("/api/v1/speech/transcribe")
                        .file(new MockMultipartFile("audio", "hello.wav", "audio/wav", new byte[]{1, 2, 3}))
                        .param("language", "en")
                        .header(HttpHeaders.AUTHORIZATION, AUTH))
                .andExpect(status().isNotImplemented())
                .andExpect(jsonPath("$.code").value("SPEECH_NOT_CONFIGURED"));
    }

    @Test
    void transcriptionReturnsEngineResult() throws Exception {
        RequestContext context = RequestContext.builder().correlationId("c").build();
        when(gatewayService.admit(eq(AUTH), anyString())).thenReturn(context);
        when(speechDispatcher.transcribe(eq(context), any(), isNull()))
                .thenReturn(TranscriptionResult.builder().text("hello").language("en").confidence(0.7).build());

        mockMvc.perform(multipart("/api/v1/speech/transcribe")
                        .file(new MockMultipartFile("audio", "hello.wav", "audio/wav", new byte[]{1, 2, 3}))
                        .header(HttpHeaders.AUTHORIZATION, AUTH))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.text").value("hello"))
                .andExpect(jsonPath("$.language").value("en"));
    }

    @Test
    void synthesisStreamsEngineAudio() throws Exception {
        RequestContext context = RequestContext.builder().correlationId("c").build();
        when(gatewayService.admit(eq(AUTH), anyString())).thenReturn(context);
        when(speechDispatcher.synthesize(context, "Hola", "es", null))
                .thenReturn(SynthesisResult.builder().audio(new byte[]{7, 8}).contentType("audio/mpeg").build());

        mockMvc.perform(post("/api/v1/speech/synthesize")
                        .header(HttpHeaders.AUTHORIZATION, AUTH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"Hola\",\"language\":\"es\"}"))
                .andExpect(status().isOk())
                .andExpect(content().contentType("audio/mpeg"))
                .andExpect(content().bytes(new byte[]{7, 8}));

        verify(gatewayService).validate(any());
    }
}
