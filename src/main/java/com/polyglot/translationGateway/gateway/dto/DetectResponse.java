package com.polyglot.translationGateway.gateway.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DetectResponse {

    private String language;

    /**
     * Always within [0, 1].
     */
    private double confidence;
}
