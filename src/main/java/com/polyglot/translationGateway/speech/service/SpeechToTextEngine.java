package com.polyglot.translationGateway.speech.service;

import com.polyglot.translationGateway.speech.model.TranscriptionResult;

/**
 * Optional speech recognition capability. Absent unless a bean is provided.
 */
public interface SpeechToTextEngine {

    /**
     * @param audio    raw audio as uploaded
     * @param language expected language, null to let the engine detect it
     */
    TranscriptionResult transcribe(byte[] audio, String language);
}
