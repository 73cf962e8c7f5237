package com.polyglot.translationGateway.language.service;

import com.polyglot.translationGateway.language.model.LanguageInfo;
import com.polyglot.translationGateway.util.JsonFileLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

/**
 * Supported-language catalog loaded once from a classpath JSON file.
 * Order of the file is the order returned to callers.
 */
@Slf4j
@Service
public class LanguageCatalog {

    private final List<LanguageInfo> languages;

    public LanguageCatalog(@Value("${gateway.languages.resource:languages.json}") String resourcePath) {
        try {
            this.languages = List.copyOf(JsonFileLoader.loadAsList(resourcePath, LanguageInfo.class));
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load language catalog from " + resourcePath, e);
        }
        log.info("Language catalog loaded - resource: {}, languages: {}", resourcePath, languages.size());
    }

    public List<LanguageInfo> listLanguages() {
        return languages;
    }
}
