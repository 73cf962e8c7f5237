package com.polyglot.translationGateway.gateway.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TranscribeResponse {

    private String text;

    private String language;

    private double confidence;
}
