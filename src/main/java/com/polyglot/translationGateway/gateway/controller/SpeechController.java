package com.polyglot.translationGateway.gateway.controller;

import com.polyglot.translationGateway.gateway.dto.SynthesizeRequest;
import com.polyglot.translationGateway.gateway.dto.TranscribeResponse;
import com.polyglot.translationGateway.gateway.filter.CorrelationIdFilter;
import com.polyglot.translationGateway.gateway.model.RequestContext;
import com.polyglot.translationGateway.gateway.service.GatewayService;
import com.polyglot.translationGateway.speech.model.SynthesisResult;
import com.polyglot.translationGateway.speech.model.TranscriptionResult;
import com.polyglot.translationGateway.speech.service.SpeechDispatcher;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * Speech endpoints. Requests pass the same auth and rate-limit gate as translation,
 * then go to whichever speech engines are configured.
 */
@RestController
@RequestMapping("/api/v1/speech")
@RequiredArgsConstructor
public class SpeechController {

    private final GatewayService gatewayService;
    private final SpeechDispatcher speechDispatcher;

    @PostMapping(value = "/transcribe", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<TranscribeResponse> transcribe(
            @RequestPart(value = "audio", required = false) MultipartFile audio,
            @RequestParam(value = "language", required = false) String language,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestAttribute(value = CorrelationIdFilter.ATTRIBUTE, required = false) String correlationId)
            throws IOException {

        RequestContext context = gatewayService.admit(authorization, correlationId);
        byte[] bytes = audio == null ? new byte[0] : audio.getBytes();
        TranscriptionResult result = speechDispatcher.transcribe(context, bytes, language);
        return ResponseEntity.ok(TranscribeResponse.builder()
                .text(result.getText())
                .language(result.getLanguage())
                .confidence(result.getConfidence())
                .build());
    }

    @PostMapping("/synthesize")
    public ResponseEntity<byte[]> synthesize(
            @RequestBody(required = false) SynthesizeRequest request,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestAttribute(value = CorrelationIdFilter.ATTRIBUTE, required = false) String correlationId) {

        RequestContext context = gatewayService.admit(authorization, correlationId);
        gatewayService.validate(request);
        SynthesisResult result = speechDispatcher.synthesize(
                context, request.getText(), request.getLanguage().trim(), request.getVoice());

        String contentType = result.getContentType() != null ? result.getContentType() : MediaType.APPLICATION_OCTET_STREAM_VALUE;
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(contentType))
                .body(result.getAudio());
    }
}
