package com.polyglot.translationGateway.language.service;

import com.polyglot.translationGateway.language.model.LanguageDetectionResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LanguageDetector should detect languages by script")
class LanguageDetectorTest {

    private final LanguageDetector detector = new LanguageDetector();

    @ParameterizedTest
    @CsvSource({
            "שלום עולם, he",
            "مرحبا بالعالم, ar",
            "Привет мир, ru",
            "Καλημέρα κόσμε, el",
            "你好世界, zh",
            "こんにちは世界, ja",
            "안녕하세요, ko",
            "สวัสดีครับ, th",
            "नमस्ते दुनिया, hi",
            "'¿Qué tal, señor?', es",
            "Grüß Gott, de",
            "Não sei, pt",
            "Ça va très bien, fr",
            "Good morning everyone, en"
    })
    void detectsDominantLanguage(String text, String expected) {
        assertThat(detector.detectLanguage(text).getLanguageCode()).isEqualTo(expected);
    }

    @Test
    void englishWithoutMarkersHasReducedConfidence() {
        LanguageDetectionResult result = detector.detectLanguage("Good morning");

        assertThat(result.getLanguageCode()).isEqualTo("en");
        assertThat(result.getConfidence()).isEqualTo(0.6);
    }

    @Test
    void blankTextGetsDefaultLanguageWithZeroConfidence() {
        LanguageDetectionResult result = detector.detectLanguage("   ");

        assertThat(result.getLanguageCode()).isEqualTo(LanguageDetector.DEFAULT_LANGUAGE);
        assertThat(result.getConfidence()).isZero();
    }

    @Test
    void textWithoutLettersGetsHalfConfidence() {
        assertThat(detector.detectLanguage("12345 !?").getConfidence()).isEqualTo(0.5);
    }

    @Test
    void confidenceReflectsScriptShare() {
        LanguageDetectionResult result = detector.detectLanguage("שלום abc");

        assertThat(result.getLanguageCode()).isEqualTo("he");
        assertThat(result.getConfidence()).isBetween(0.5, 0.6);
    }
}
