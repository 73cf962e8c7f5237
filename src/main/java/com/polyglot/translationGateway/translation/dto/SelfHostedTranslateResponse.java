package com.polyglot.translationGateway.translation.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for a LibreTranslate-compatible {@code /translate} call made with an array {@code q}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class SelfHostedTranslateResponse {

    @JsonProperty("translatedText")
    private List<String> translatedText;

    /**
     * Present only when source was "auto"; one entry per input text.
     */
    @JsonProperty("detectedLanguage")
    private List<DetectedLanguage> detectedLanguage;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DetectedLanguage {

        /**
         * Percentage, 0 to 100.
         */
        @JsonProperty("confidence")
        private Double confidence;

        @JsonProperty("language")
        private String language;
    }
}
