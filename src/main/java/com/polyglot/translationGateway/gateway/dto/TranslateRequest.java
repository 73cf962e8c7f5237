package com.polyglot.translationGateway.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO for batch translation. Texts are kept exactly as sent.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TranslateRequest {

    private List<String> texts;

    @NotBlank(message = "must not be blank")
    private String target;

    /**
     * Source language, "auto" (default) to detect per text.
     */
    @Builder.Default
    private String source = "auto";

    /**
     * "text" (default) or "html".
     */
    @Builder.Default
    private String format = "text";

    @Size(max = 128, message = "must be at most 128 characters")
    @JsonProperty("glossary_id")
    private String glossaryId;

    @Valid
    private Options options;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Options {

        @Size(max = 32, message = "must be at most 32 characters")
        private String formality;

        @JsonProperty("preserve_entities")
        private Boolean preserveEntities;
    }
}
