package com.polyglot.translationGateway.gateway.controller;

import com.polyglot.translationGateway.gateway.dto.CacheStatsResponse;
import com.polyglot.translationGateway.gateway.dto.DetectRequest;
import com.polyglot.translationGateway.gateway.dto.DetectResponse;
import com.polyglot.translationGateway.gateway.dto.TranslateRequest;
import com.polyglot.translationGateway.gateway.dto.TranslateResponse;
import com.polyglot.translationGateway.gateway.filter.CorrelationIdFilter;
import com.polyglot.translationGateway.gateway.service.GatewayService;
import com.polyglot.translationGateway.language.model.LanguageInfo;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Gateway REST controller - thin HTTP layer for translation requests.
 *
 * Responsibilities:
 * - Handle HTTP requests/responses
 * - Extract the Authorization header and the correlation ID
 * - Delegate business logic to GatewayService
 *
 * Bodies are validated by GatewayService after authentication, not by {@code @Valid}.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class GatewayController {

    private final GatewayService gatewayService;

    @PostMapping("/translate")
    public ResponseEntity<TranslateResponse> translate(
            @RequestBody(required = false) TranslateRequest request,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestAttribute(value = CorrelationIdFilter.ATTRIBUTE, required = false) String correlationId) {

        return ResponseEntity.ok(gatewayService.translate(request, authorization, correlationId));
    }

    @PostMapping("/detect")
    public ResponseEntity<DetectResponse> detect(
            @RequestBody(required = false) DetectRequest request,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestAttribute(value = CorrelationIdFilter.ATTRIBUTE, required = false) String correlationId) {

        return ResponseEntity.ok(gatewayService.detect(request, authorization, correlationId));
    }

    /**
     * Supported languages. Public.
     */
    @GetMapping("/languages")
    public ResponseEntity<List<LanguageInfo>> languages() {
        return ResponseEntity.ok(gatewayService.languages());
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<CacheStatsResponse> cacheStats(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestAttribute(value = CorrelationIdFilter.ATTRIBUTE, required = false) String correlationId) {

        return ResponseEntity.ok(gatewayService.cacheStats(authorization, correlationId));
    }
}
