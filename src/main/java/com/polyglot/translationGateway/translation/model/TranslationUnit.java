package com.polyglot.translationGateway.translation.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One logical text to translate. Immutable once created.
 */
@Value
@Builder(toBuilder = true)
public class TranslationUnit {

    public static final String AUTO = "auto";

    /**
     * Text exactly as submitted. Never trimmed.
     */
    @NonNull
    String text;

    /**
     * Source language code, or {@link #AUTO} to let the provider detect it.
     */
    @NonNull
    @Builder.Default
    String sourceLang = AUTO;

    @NonNull
    String targetLang;

    @NonNull
    @Builder.Default
    TextFormat format = TextFormat.TEXT;

    public boolean isAutoDetect() {
        return AUTO.equalsIgnoreCase(sourceLang);
    }

    /**
     * Whether the explicit source language already equals the target.
     */
    public boolean isPassThrough() {
        return !isAutoDetect() && sourceLang.equalsIgnoreCase(targetLang);
    }
}
