package com.polyglot.translationGateway.translation.cache;

import com.polyglot.translationGateway.translation.model.BatchOptions;
import com.polyglot.translationGateway.translation.model.TextFormat;
import com.polyglot.translationGateway.translation.model.TranslationUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CacheKey should fingerprint every output-affecting field")
class CacheKeyTest {

    private static TranslationUnit unit(String text, String source, String target) {
        return TranslationUnit.builder().text(text).sourceLang(source).targetLang(target).build();
    }

    @Test
    void sameInputsGiveSameKey() {
        CacheKey first = CacheKey.of(unit("Hello", "en", "es"), BatchOptions.NONE);
        CacheKey second = CacheKey.of(unit("Hello", "en", "es"), BatchOptions.NONE);

        assertThat(first).isEqualTo(second);
        assertThat(first.hashCode()).isEqualTo(second.hashCode());
        assertThat(first.fingerprint()).hasSize(64);
    }

    @Test
    void differentGlossaryIdsGiveDifferentKeys() {
        TranslationUnit unit = unit("Save", "en", "es");

        CacheKey uiTerms = CacheKey.of(unit, BatchOptions.builder().glossaryId("ui-terms").build());
        CacheKey legal = CacheKey.of(unit, BatchOptions.builder().glossaryId("legal").build());
        CacheKey none = CacheKey.of(unit, BatchOptions.NONE);

        assertThat(uiTerms).isNotEqualTo(legal);
        assertThat(uiTerms).isNotEqualTo(none);
    }

    @Test
    void formalityIsPartOfTheKey() {
        TranslationUnit unit = unit("Thank you", "en", "de");

        assertThat(CacheKey.of(unit, BatchOptions.builder().formality("formal").build()))
                .isNotEqualTo(CacheKey.of(unit, BatchOptions.builder().formality("informal").build()));
    }

    @Test
    void absentGlossaryDiffersFromEmptyGlossary() {
        TranslationUnit unit = unit("Save", "en", "es");

        assertThat(CacheKey.of(unit, BatchOptions.builder().glossaryId("").build()))
                .isNotEqualTo(CacheKey.of(unit, BatchOptions.NONE));
    }

    @Test
    void fieldBoundariesDoNotCollide() {
        assertThat(CacheKey.of(unit("ab", "c", "es"), BatchOptions.NONE))
                .isNotEqualTo(CacheKey.of(unit("a", "bc", "es"), BatchOptions.NONE));
    }

    @Test
    void textIsNeitherTrimmedNorCaseFolded() {
        CacheKey plain = CacheKey.of(unit("Hello", "en", "es"), BatchOptions.NONE);

        assertThat(CacheKey.of(unit("Hello ", "en", "es"), BatchOptions.NONE)).isNotEqualTo(plain);
        assertThat(CacheKey.of(unit("hello", "en", "es"), BatchOptions.NONE)).isNotEqualTo(plain);
    }

    @Test
    void formatIsPartOfTheKey() {
        TranslationUnit text = unit("<b>Hello</b>", "en", "es");
        TranslationUnit html = text.toBuilder().format(TextFormat.HTML).build();

        assertThat(CacheKey.of(text, BatchOptions.NONE)).isNotEqualTo(CacheKey.of(html, BatchOptions.NONE));
    }

    @Test
    void preserveEntitiesDoesNotChangeTheKey() {
        TranslationUnit unit = unit("Hello", "en", "es");

        assertThat(CacheKey.of(unit, BatchOptions.builder().preserveEntities(true).build()))
                .isEqualTo(CacheKey.of(unit, BatchOptions.NONE));
    }
}
