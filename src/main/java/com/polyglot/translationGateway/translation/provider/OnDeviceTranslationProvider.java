package com.polyglot.translationGateway.translation.provider;

import com.polyglot.translationGateway.language.model.LanguageDetectionResult;
import com.polyglot.translationGateway.language.service.LanguageDetector;
import com.polyglot.translationGateway.translation.exception.ProviderException;
import com.polyglot.translationGateway.translation.model.BatchOptions;
import com.polyglot.translationGateway.translation.model.ProviderResult;
import com.polyglot.translationGateway.translation.model.TextFormat;
import com.polyglot.translationGateway.translation.model.TranslationUnit;
import com.polyglot.translationGateway.util.JsonFileLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * In-process provider backed by a bundled phrasebook.
 * 
 * Translation strategy per unit:
 * - Glossary term or phrasebook entry matching the whole text (surrounding whitespace kept as is)
 * - Otherwise word-by-word substitution, unknown words left untouched
 * - HTML units only have their text nodes translated; tags and attributes are copied verbatim
 * 
 * Language detection for "auto" units uses the heuristic {@link LanguageDetector}.
 */
@Slf4j
@Service
public class OnDeviceTranslationProvider implements TranslationProvider {

    public static final String ID = "on-device";

    private static final Pattern HTML_TAG = Pattern.compile("<[^>]*>");
    private static final Pattern WORD = Pattern.compile("\\p{L}+");

    private final LanguageDetector languageDetector;
    private final Phrasebook phrasebook;

    @Autowired
    public OnDeviceTranslationProvider(
            LanguageDetector languageDetector,
            @Value("${on-device.phrasebook:phrasebook.json}") String phrasebookResource) {
        this(languageDetector, loadPhrasebook(phrasebookResource));
        log.info("On-device phrasebook loaded - resource: {}, languages: {}", phrasebookResource, phrasebook.getLanguages());
    }

    OnDeviceTranslationProvider(LanguageDetector languageDetector, Phrasebook phrasebook) {
        this.languageDetector = languageDetector;
        this.phrasebook = phrasebook;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<ProviderResult> translateBatch(List<TranslationUnit> units, BatchOptions options) {
        Map<String, Map<String, Map<String, String>>> glossary = resolveGlossary(options.getGlossaryId());
        List<ProviderResult> results = new ArrayList<>(units.size());
        for (TranslationUnit unit : units) {
            long started = System.nanoTime();
            String source = unit.isAutoDetect()
                    ? languageDetector.detectLanguage(unit.getText()).getLanguageCode()
                    : unit.getSourceLang().toLowerCase(Locale.ROOT);
            String target = unit.getTargetLang().toLowerCase(Locale.ROOT);
            requireSupported(source, target);

            String translated = source.equals(target)
                    ? unit.getText()
                    : translate(unit.getText(), unit.getFormat(), source, target,
                            Phrasebook.table(glossary, source, target));

            results.add(ProviderResult.builder()
                    .text(translated)
                    .detectedSource(unit.isAutoDetect() ? source : null)
                    .providerId(ID)
                    .latencyMs((System.nanoTime() - started) / 1_000_000L)
                    .build());
        }
        return results;
    }

    @Override
    public LanguageDetectionResult detect(String text) {
        return languageDetector.detectLanguage(text);
    }

    private Map<String, Map<String, Map<String, String>>> resolveGlossary(String glossaryId) {
        if (glossaryId == null) {
            return Map.of();
        }
        Map<String, Map<String, Map<String, String>>> glossary = phrasebook.getGlossaries().get(glossaryId);
        if (glossary == null) {
            throw ProviderException.permanent(ID, "UNKNOWN_GLOSSARY", "Glossary not found: " + glossaryId);
        }
        return glossary;
    }

    private void requireSupported(String source, String target) {
        List<String> languages = phrasebook.getLanguages();
        if (!languages.contains(source) || !languages.contains(target)) {
            throw ProviderException.permanent(ID, "UNSUPPORTED_LANGUAGE_PAIR",
                    "Language pair not supported on device: " + source + " -> " + target);
        }
    }

    private String translate(String text, TextFormat format, String source, String target, Map<String, String> glossaryTerms) {
        if (format != TextFormat.HTML) {
            return translateSegment(text, source, target, glossaryTerms);
        }
        StringBuilder out = new StringBuilder(text.length());
        Matcher tags = HTML_TAG.matcher(text);
        int position = 0;
        while (tags.find()) {
            out.append(translateSegment(text.substring(position, tags.start()), source, target, glossaryTerms));
            out.append(tags.group());
            position = tags.end();
        }
        out.append(translateSegment(text.substring(position), source, target, glossaryTerms));
        return out.toString();
    }

    private String translateSegment(String segment, String source, String target, Map<String, String> glossaryTerms) {
        String core = segment.strip();
        if (core.isEmpty()) {
            return segment;
        }
        String whole = glossaryTerms.getOrDefault(core, phrasebook.phrases(source, target).get(core));
        if (whole != null) {
            int leading = segment.indexOf(core);
            return segment.substring(0, leading) + whole + segment.substring(leading + core.length());
        }

        Map<String, String> words = phrasebook.words(source, target);
        Matcher matcher = WORD.matcher(segment);
        StringBuilder out = new StringBuilder(segment.length());
        while (matcher.find()) {
            String word = matcher.group();
            String replacement = glossaryTerms.get(word);
            if (replacement == null) {
                String lookedUp = words.get(word.toLowerCase(Locale.ROOT));
                replacement = lookedUp == null ? word : matchCapitalization(word, lookedUp);
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static String matchCapitalization(String original, String replacement) {
        if (replacement.isEmpty() || !Character.isUpperCase(original.codePointAt(0))) {
            return replacement;
        }
        int first = replacement.codePointAt(0);
        return new StringBuilder()
                .appendCodePoint(Character.toUpperCase(first))
                .append(replacement.substring(Character.charCount(first)))
                .toString();
    }

    private static Phrasebook loadPhrasebook(String resource) {
        try {
            return JsonFileLoader.loadAsObject(resource, Phrasebook.class);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load on-device phrasebook from " + resource, e);
        }
    }
}
