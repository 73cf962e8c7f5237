package com.polyglot.translationGateway.translation.provider;

import com.polyglot.translationGateway.util.JsonFileLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Named glossaries shared by the remote providers, read from the {@code glossaries}
 * section of the phrasebook resource.
 */
@Slf4j
@Component
public class GlossaryCatalog {

    private final Map<String, Map<String, Map<String, Map<String, String>>>> glossaries;

    @Autowired
    public GlossaryCatalog(@Value("${on-device.phrasebook:phrasebook.json}") String resource) {
        this(load(resource).getGlossaries());
        log.info("Glossaries loaded - resource: {}, ids: {}", resource, glossaries.keySet());
    }

    GlossaryCatalog(Map<String, Map<String, Map<String, Map<String, String>>>> glossaries) {
        this.glossaries = glossaries == null ? Map.of() : glossaries;
    }

    public Optional<Map<String, Map<String, Map<String, String>>>> find(String glossaryId) {
        return Optional.ofNullable(glossaries.get(glossaryId));
    }

    /**
     * Keeps the entries of a glossary that translate into one of the given targets.
     * The result is keyed source language, then target language, then term.
     */
    public static Map<String, Map<String, Map<String, String>>> forTargets(
            Map<String, Map<String, Map<String, String>>> glossary, Set<String> targets) {
        Map<String, Map<String, Map<String, String>>> filtered = new LinkedHashMap<>();
        glossary.forEach((source, byTarget) -> byTarget.forEach((target, terms) -> {
            if (targets.contains(target) && !terms.isEmpty()) {
                filtered.computeIfAbsent(source, k -> new LinkedHashMap<>()).put(target, terms);
            }
        }));
        return filtered;
    }

    private static Phrasebook load(String resource) {
        try {
            return JsonFileLoader.loadAsObject(resource, Phrasebook.class);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load glossaries from " + resource, e);
        }
    }
}
