package com.polyglot.translationGateway.gateway.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TranslationItem {

    private String text;

    /**
     * Present only when the source language was detected.
     */
    @JsonProperty("detected_source")
    private String detectedSource;
}
