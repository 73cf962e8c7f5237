package com.polyglot.translationGateway.gateway.controller;

import com.polyglot.translationGateway.gateway.dto.ErrorResponse;
import com.polyglot.translationGateway.gateway.dto.FailureItem;
import com.polyglot.translationGateway.gateway.exception.ForbiddenException;
import com.polyglot.translationGateway.gateway.exception.RateLimitExceededException;
import com.polyglot.translationGateway.gateway.exception.SpeechNotConfiguredException;
import com.polyglot.translationGateway.gateway.exception.UnauthorizedException;
import com.polyglot.translationGateway.gateway.exception.ValidationException;
import com.polyglot.translationGateway.gateway.service.GatewayService;
import com.polyglot.translationGateway.translation.exception.PartialFailureException;
import com.polyglot.translationGateway.translation.exception.RequestCancelledException;
import com.polyglot.translationGateway.translation.exception.RequestTimeoutException;
import com.polyglot.translationGateway.translation.exception.TotalFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.util.List;

/**
 * Global exception handler for the Gateway.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(ValidationException ex) {
        log.warn("Validation error: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.builder()
                        .code("VALIDATION_ERROR")
                        .message(ex.getMessage())
                        .field(ex.getField())
                        .reason(ex.getReason())
                        .build());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.builder()
                        .code("VALIDATION_ERROR")
                        .message("Request body is not valid JSON")
                        .field("body")
                        .reason("malformed JSON")
                        .build());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
        log.warn("Upload too large: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(ErrorResponse.of("PAYLOAD_TOO_LARGE", "Uploaded audio exceeds the size limit"));
    }

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorized(UnauthorizedException ex) {
        log.warn("Unauthorized request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
                .body(ErrorResponse.of("UNAUTHORIZED", ex.getMessage()));
    }

    @ExceptionHandler(ForbiddenException.class)
    public ResponseEntity<ErrorResponse> handleForbidden(ForbiddenException ex) {
        log.warn("Forbidden request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(ErrorResponse.of("FORBIDDEN", ex.getMessage()));
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleRateLimitExceeded(RateLimitExceededException ex) {
        log.warn("Rate limit exceeded: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
                .body(ErrorResponse.builder()
                        .code("RATE_LIMIT_EXCEEDED")
                        .message(ex.getMessage())
                        .retryAfterMs(ex.getRetryAfterMs())
                        .build());
    }

    @ExceptionHandler(PartialFailureException.class)
    public ResponseEntity<ErrorResponse> handlePartialFailure(PartialFailureException ex) {
        log.warn("Partial translation failure: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ErrorResponse.builder()
                        .code("PARTIAL_FAILURE")
                        .message(ex.getMessage())
                        .translations(GatewayService.toItems(ex.getOutcomes()))
                        .failures(ex.getFailures().stream().map(FailureItem::from).toList())
                        .build());
    }

    @ExceptionHandler(TotalFailureException.class)
    public ResponseEntity<ErrorResponse> handleTotalFailure(TotalFailureException ex) {
        HttpStatus status = ex.isRetryable() ? HttpStatus.BAD_GATEWAY : HttpStatus.UNPROCESSABLE_ENTITY;
        log.warn("Translation failed for every text: {}, status: {}", ex.getMessage(), status.value());
        List<FailureItem> failures = ex.getFailures().stream().map(FailureItem::from).toList();
        return ResponseEntity.status(status)
                .body(ErrorResponse.builder()
                        .code("TOTAL_FAILURE")
                        .message(ex.getMessage())
                        .failures(failures)
                        .build());
    }

    @ExceptionHandler(RequestTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleTimeout(RequestTimeoutException ex) {
        log.warn("Request timed out: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                .body(ErrorResponse.of("REQUEST_TIMEOUT", ex.getMessage()));
    }

    @ExceptionHandler(RequestCancelledException.class)
    public ResponseEntity<ErrorResponse> handleCancelled(RequestCancelledException ex) {
        log.warn("Request cancelled: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorResponse.of("REQUEST_CANCELLED", ex.getMessage()));
    }

    @ExceptionHandler(SpeechNotConfiguredException.class)
    public ResponseEntity<ErrorResponse> handleSpeechNotConfigured(SpeechNotConfiguredException ex) {
        log.warn("Speech engine missing: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_IMPLEMENTED)
                .body(ErrorResponse.of("SPEECH_NOT_CONFIGURED", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of("INTERNAL_ERROR", "An unexpected error occurred"));
    }
}
