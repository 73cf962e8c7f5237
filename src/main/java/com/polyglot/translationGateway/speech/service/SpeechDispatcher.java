package com.polyglot.translationGateway.speech.service;

import com.polyglot.translationGateway.gateway.exception.SpeechNotConfiguredException;
import com.polyglot.translationGateway.gateway.exception.ValidationException;
import com.polyglot.translationGateway.gateway.model.RequestContext;
import com.polyglot.translationGateway.speech.model.SynthesisResult;
import com.polyglot.translationGateway.speech.model.TranscriptionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Hands admitted speech requests to the configured engines.
 * Callers must have passed the auth and rate-limit gate already.
 */
@Slf4j
@Service
public class SpeechDispatcher {

    private final ObjectProvider<SpeechToTextEngine> speechToText;
    private final ObjectProvider<TextToSpeechEngine> textToSpeech;

    public SpeechDispatcher(ObjectProvider<SpeechToTextEngine> speechToText,
                            ObjectProvider<TextToSpeechEngine> textToSpeech) {
        this.speechToText = speechToText;
        this.textToSpeech = textToSpeech;
    }

    public TranscriptionResult transcribe(RequestContext context, byte[] audio, String language) {
        SpeechToTextEngine engine = speechToText.getIfAvailable();
        if (engine == null) {
            log.warn("Transcription requested without engine - correlationId: {}", context.getCorrelationId());
            throw new SpeechNotConfiguredException("Speech-to-text is not configured");
        }
        if (audio == null || audio.length == 0) {
            throw new ValidationException("audio", "must not be empty");
        }
        String expected = language == null || language.isBlank() ? null : language.trim();
        log.info("Dispatching transcription - correlationId: {}, bytes: {}, language: {}",
                context.getCorrelationId(), audio.length, expected == null ? "auto" : expected);
        return engine.transcribe(audio, expected);
    }

    public SynthesisResult synthesize(RequestContext context, String text, String language, String voice) {
        TextToSpeechEngine engine = textToSpeech.getIfAvailable();
        if (engine == null) {
            log.warn("Synthesis requested without engine - correlationId: {}", context.getCorrelationId());
            throw new SpeechNotConfiguredException("Text-to-speech is not configured");
        }
        log.info("Dispatching synthesis - correlationId: {}, chars: {}, language: {}",
                context.getCorrelationId(), text.length(), language);
        return engine.synthesize(text, language, voice);
    }
}
