package com.polyglot.translationGateway.gateway.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SynthesizeRequest {

    @NotBlank(message = "must not be blank")
    @Size(max = 5000, message = "must be at most 5000 characters")
    private String text;

    @NotBlank(message = "must not be blank")
    private String language;

    /**
     * Engine specific voice name, engine default when absent.
     */
    private String voice;
}
