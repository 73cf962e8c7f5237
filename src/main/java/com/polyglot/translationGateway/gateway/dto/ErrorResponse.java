package com.polyglot.translationGateway.gateway.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Uniform error body. Only the fields relevant to the error code are present.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private String code;

    private String message;

    /**
     * Offending request field, for validation errors.
     */
    private String field;

    private String reason;

    @JsonProperty("retry_after_ms")
    private Long retryAfterMs;

    /**
     * Index-aligned results of a partially failed batch; null where the unit failed.
     */
    private List<TranslationItem> translations;

    private List<FailureItem> failures;

    public static ErrorResponse of(String code, String message) {
        return ErrorResponse.builder().code(code).message(message).build();
    }
}
