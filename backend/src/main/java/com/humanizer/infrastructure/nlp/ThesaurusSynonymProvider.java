package com.humanizer.infrastructure.nlp;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.humanizer.domain.language.model.PartOfSpeech;
import com.humanizer.domain.language.model.SynonymCandidate;
import com.humanizer.domain.language.service.LexicalRelationProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Synonym sets from a bundled JSON thesaurus of the form
 * {@code {"adj": {"lemma": [{"word": "...", "frequency": 12}]}, "noun": {...}, "verb": {...}, "adv": {...}}}.
 */
@Slf4j
@Component
public class ThesaurusSynonymProvider implements LexicalRelationProvider {

    public static final String DEFAULT_PATH = "lexicon/thesaurus.json";

    private static final Map<String, PartOfSpeech> SECTIONS = Map.of(
            "adj", PartOfSpeech.ADJ,
            "noun", PartOfSpeech.NOUN,
            "verb", PartOfSpeech.VERB,
            "adv", PartOfSpeech.ADV
    );

    private final Map<PartOfSpeech, Map<String, List<SynonymCandidate>>> entries = new EnumMap<>(PartOfSpeech.class);

    public ThesaurusSynonymProvider(@Value("${humanizer.thesaurus.path:" + DEFAULT_PATH + "}") String resourcePath) {
        Map<String, Map<String, List<SynonymCandidate>>> raw = load(resourcePath);
        raw.forEach((section, lemmas) -> {
            PartOfSpeech pos = SECTIONS.get(section.toLowerCase(Locale.ROOT));
            if (pos == null) {
                log.warn("[Thesaurus] Ignoring unknown section '{}'", section);
                return;
            }
            entries.put(pos, Map.copyOf(lemmas));
        });
        log.info("[Thesaurus] Loaded {} synonym sets from {}",
                entries.values().stream().mapToInt(Map::size).sum(), resourcePath);
    }

    private static Map<String, Map<String, List<SynonymCandidate>>> load(String resourcePath) {
        try (InputStream in = ThesaurusSynonymProvider.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (in == null) {
                log.warn("[Thesaurus] Resource not found: {} (lexical substitution disabled)", resourcePath);
                return Map.of();
            }
            return new ObjectMapper().readValue(in, new TypeReference<>() {});
        } catch (IOException e) {
            log.warn("[Thesaurus] Failed to read {} (lexical substitution disabled)", resourcePath, e);
            return Map.of();
        }
    }

    @Override
    public List<SynonymCandidate> synonyms(String lemma, PartOfSpeech pos) {
        if (lemma == null || pos == null) {
            return List.of();
        }
        Map<String, List<SynonymCandidate>> section = entries.get(pos);
        if (section == null) {
            return List.of();
        }
        return section.getOrDefault(lemma.toLowerCase(Locale.ROOT), List.of());
    }
}
