package com.polyglot.translationGateway.language.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Entry of the supported-language catalog.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LanguageInfo {

    @JsonProperty("code")
    private String code;

    @JsonProperty("name")
    private String name;

    /**
     * "ltr" or "rtl".
     */
    @JsonProperty("direction")
    private String direction;

    @JsonProperty("supports_transliteration")
    private boolean supportsTransliteration;
}
