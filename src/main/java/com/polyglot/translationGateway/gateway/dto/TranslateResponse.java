package com.polyglot.translationGateway.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for batch translation, index-aligned with the request texts.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TranslateResponse {

    private List<TranslationItem> translations;

    @JsonProperty("correlation_id")
    private String correlationId;
}
