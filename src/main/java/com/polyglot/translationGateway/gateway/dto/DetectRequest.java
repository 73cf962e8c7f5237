package com.polyglot.translationGateway.gateway.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DetectRequest {

    @NotBlank(message = "must not be blank")
    private String text;
}
