package com.polyglot.translationGateway.translation.prompt;

import java.util.Map;

/**
 * System prompts for the cloud (LLM-backed) provider.
 * 
 * The model receives a JSON array of items and must answer with a JSON array
 * of the same length, keyed by item id, so that batch order survives the round trip.
 */
public class TranslationSystemPrompt {

    private TranslationSystemPrompt() {
    }
    
    /**
     * Returns the system prompt for batch translation.
     * 
     * @param formality requested register ("formal", "informal", ...), null for default
     * @param preserveEntities whether named entities must be kept verbatim
     * @param glossary mandatory terms keyed source, target, term; empty for none
     * @return System prompt string
     */
    public static String getBatchTranslationPrompt(String formality, boolean preserveEntities,
                                                   Map<String, Map<String, Map<String, String>>> glossary) {
        StringBuilder prompt = new StringBuilder("""
            You are a professional translation engine.
            
            INPUT:
            A JSON array of items: {"id": number, "text": string, "source": string, "target": string, "format": "text"|"html"}.
            "source" may be "auto", in which case you must detect the source language.
            
            CRITICAL REQUIREMENTS:
            
            1. TRANSLATE EACH ITEM INDEPENDENTLY:
               - Translate "text" from "source" into "target"
               - Translate the MEANING, not word-for-word
               - If source and target are the same language, return the text unchanged
            
            2. PRESERVE EXACT VALUES:
               - Numbers, dates, currencies, URLs, e-mail addresses and placeholders like {name} or %s stay unchanged
               - Leading and trailing whitespace and line breaks stay exactly as in the input
            
            3. HTML ITEMS:
               - Translate text nodes only
               - Keep every tag, attribute and entity exactly as written
            
            4. DO NOT add explanations, notes or alternatives
            """);

        if (formality != null && !formality.isBlank()) {
            prompt.append("""
            
            5. REGISTER:
               - Use a %s register in every translation
            """.formatted(formality));
        }
        if (preserveEntities) {
            prompt.append("""
            
            6. NAMED ENTITIES:
               - Keep names of people, organizations, products and places exactly as written
            """);
        }

        if (glossary != null && !glossary.isEmpty()) {
            prompt.append("""
            
            7. GLOSSARY:
               - Translate these terms exactly as listed, wherever they appear
            """);
            glossary.forEach((source, byTarget) -> byTarget.forEach((target, terms) -> {
                prompt.append("   - From ").append(source).append(" to ").append(target).append(":\n");
                terms.forEach((term, translation) -> prompt.append("     \"")
                        .append(term).append("\" -> \"").append(translation).append("\"\n"));
            }));
        }

        prompt.append("""
            
            OUTPUT REQUIREMENTS:
            - Return ONLY a JSON array with one object per input item, in input order
            - Each object: {"id": <same id>, "text": "<translation>", "detected_source": "<ISO 639-1 code of the source>"}
            - No markdown fences, no prose
            """);
        return prompt.toString();
    }
    
    /**
     * Returns the system prompt for language detection.
     * 
     * @return System prompt string
     */
    public static String getDetectionPrompt() {
        return """
            You are a language identification engine.
            Identify the language of the user message.
            Return ONLY a JSON object: {"language": "<ISO 639-1 code>", "confidence": <number between 0 and 1>}
            No markdown fences, no prose.
            """;
    }
}
