package com.polyglot.translationGateway.speech.model;

import lombok.Builder;
import lombok.Value;

/**
 * Synthesized audio as produced by the engine. The gateway does not transcode it.
 */
@Value
@Builder
public class SynthesisResult {

    byte[] audio;

    /**
     * MIME type of {@link #audio}, e.g. {@code audio/mpeg}.
     */
    String contentType;
}
