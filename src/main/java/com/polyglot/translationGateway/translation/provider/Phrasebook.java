package com.polyglot.translationGateway.translation.provider;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Bundled translation tables of the on-device provider.
 *
 * Tables are keyed source language, then target language, then source term.
 * Glossaries add one more level in front: glossary id.
 */
@Data
@NoArgsConstructor
public class Phrasebook {

    private List<String> languages = List.of();

    /** Whole-text translations. */
    private Map<String, Map<String, Map<String, String>>> phrases = Map.of();

    /** Word-level fallback translations, keys in lower case. */
    private Map<String, Map<String, Map<String, String>>> words = Map.of();

    private Map<String, Map<String, Map<String, Map<String, String>>>> glossaries = Map.of();

    Map<String, String> phrases(String source, String target) {
        return table(phrases, source, target);
    }

    Map<String, String> words(String source, String target) {
        return table(words, source, target);
    }

    static Map<String, String> table(Map<String, Map<String, Map<String, String>>> tables, String source, String target) {
        Map<String, Map<String, String>> bySource = tables.get(source);
        if (bySource == null) {
            return Map.of();
        }
        return bySource.getOrDefault(target, Map.of());
    }
}
