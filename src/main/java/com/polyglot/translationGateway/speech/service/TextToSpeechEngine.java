package com.polyglot.translationGateway.speech.service;

import com.polyglot.translationGateway.speech.model.SynthesisResult;

/**
 * Optional speech synthesis capability. Absent unless a bean is provided.
 */
public interface TextToSpeechEngine {

    /**
     * @param voice engine specific voice, null for the engine default
     */
    SynthesisResult synthesize(String text, String language, String voice);
}
