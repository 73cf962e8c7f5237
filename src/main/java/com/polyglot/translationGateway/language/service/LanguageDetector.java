package com.polyglot.translationGateway.language.service;

import com.polyglot.translationGateway.language.model.LanguageDetectionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Heuristic, in-process language detector.
 * 
 * Detection strategy:
 * - Count letters per Unicode script (Hebrew, Arabic, Cyrillic, Greek, Han, Kana, Hangul, Thai, Devanagari)
 * - The dominant script decides the language; confidence is its share of all letters
 * - Latin script is refined by marker characters (Spanish, German, French, Portuguese),
 *   otherwise English is assumed
 * 
 * Used by the on-device provider and as the last resort when no provider can detect.
 */
@Slf4j
@Service
public class LanguageDetector {

    public static final String DEFAULT_LANGUAGE = "en";

    private static final Pattern SPANISH_MARKERS = Pattern.compile("[ñ¿¡]", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern GERMAN_MARKERS = Pattern.compile("[äöüß]", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern FRENCH_MARKERS = Pattern.compile("[çœèêëàâîïûù]", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern PORTUGUESE_MARKERS = Pattern.compile("[ãõ]", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    /**
     * Detects the language of the given text.
     * 
     * @param text The text to analyze
     * @return detection result; blank input yields the default language with zero confidence
     */
    public LanguageDetectionResult detectLanguage(String text) {
        if (text == null || text.isBlank()) {
            log.warn("Empty text provided for language detection");
            return LanguageDetectionResult.builder()
                    .languageCode(DEFAULT_LANGUAGE)
                    .confidence(0.0)
                    .build();
        }

        Map<String, Integer> letterCounts = new LinkedHashMap<>();
        int totalLetters = 0;
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            i += Character.charCount(codePoint);
            if (!Character.isLetter(codePoint)) {
                continue;
            }
            totalLetters++;
            letterCounts.merge(scriptLanguage(codePoint), 1, Integer::sum);
        }

        if (totalLetters == 0) {
            // digits and punctuation only
            return LanguageDetectionResult.builder()
                    .languageCode(DEFAULT_LANGUAGE)
                    .confidence(0.5)
                    .build();
        }

        // kanji mixed with kana is Japanese
        if (letterCounts.containsKey("ja") && letterCounts.containsKey("zh")) {
            letterCounts.merge("ja", letterCounts.remove("zh"), Integer::sum);
        }

        Map.Entry<String, Integer> dominant = letterCounts.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .orElseThrow();

        String language = dominant.getKey();
        double confidence = (double) dominant.getValue() / totalLetters;
        if ("latin".equals(language)) {
            language = refineLatin(text);
            if (DEFAULT_LANGUAGE.equals(language)) {
                // no marker characters, so English is only a guess
                confidence = confidence * 0.6;
            }
        }

        log.debug("Language detection - detected: {}, confidence: {}", language, String.format("%.2f", confidence));

        return LanguageDetectionResult.builder()
                .languageCode(language)
                .confidence(Math.min(1.0, confidence))
                .build();
    }

    private String scriptLanguage(int codePoint) {
        Character.UnicodeScript script = Character.UnicodeScript.of(codePoint);
        switch (script) {
            case HEBREW:
                return "he";
            case ARABIC:
                return "ar";
            case CYRILLIC:
                return "ru";
            case GREEK:
                return "el";
            case HAN:
                return "zh";
            case HIRAGANA:
            case KATAKANA:
                return "ja";
            case HANGUL:
                return "ko";
            case THAI:
                return "th";
            case DEVANAGARI:
                return "hi";
            default:
                return "latin";
        }
    }

    private String refineLatin(String text) {
        if (SPANISH_MARKERS.matcher(text).find()) {
            return "es";
        }
        if (GERMAN_MARKERS.matcher(text).find()) {
            return "de";
        }
        if (PORTUGUESE_MARKERS.matcher(text).find()) {
            return "pt";
        }
        if (FRENCH_MARKERS.matcher(text).find()) {
            return "fr";
        }
        return DEFAULT_LANGUAGE;
    }
}
