package com.polyglot.translationGateway.translation.cache;

import com.polyglot.translationGateway.translation.model.BatchOptions;
import com.polyglot.translationGateway.translation.model.TranslationUnit;
import lombok.EqualsAndHashCode;
import org.apache.commons.codec.digest.DigestUtils;

/**
 * Deterministic fingerprint of every field that affects translation output:
 * text, source, target, format, glossary id and formality.
 *
 * Fields are length-prefixed before hashing, so that shifting characters
 * between adjacent fields always changes the key. Absent optional fields are
 * encoded differently from empty strings. No trimming or case folding is applied.
 */
@EqualsAndHashCode
public final class CacheKey {

    private final String fingerprint;

    private CacheKey(String fingerprint) {
        this.fingerprint = fingerprint;
    }

    public static CacheKey of(TranslationUnit unit, BatchOptions options) {
        StringBuilder material = new StringBuilder(unit.getText().length() + 64);
        append(material, unit.getText());
        append(material, unit.getSourceLang());
        append(material, unit.getTargetLang());
        append(material, unit.getFormat().wireValue());
        append(material, options.getGlossaryId());
        append(material, options.getFormality());
        return new CacheKey(DigestUtils.sha256Hex(material.toString()));
    }

    public String fingerprint() {
        return fingerprint;
    }

    private static void append(StringBuilder material, String value) {
        if (value == null) {
            material.append('-');
            return;
        }
        material.append(value.length()).append(':').append(value);
    }

    @Override
    public String toString() {
        return fingerprint.substring(0, 12);
    }
}
