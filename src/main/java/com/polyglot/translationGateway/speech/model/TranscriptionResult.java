package com.polyglot.translationGateway.speech.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TranscriptionResult {

    String text;

    /**
     * Spoken language, as given by the caller or detected by the engine.
     */
    String language;

    double confidence;
}
