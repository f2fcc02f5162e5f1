package com.humanizer.infrastructure.nlp;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Open-class English word lists (nouns, verb base forms, adjectives, adverbs) plus irregular
 * inflection tables, loaded once from a classpath JSON resource.
 * <p>
 * A missing or unreadable resource leaves the lexicon unloaded; the annotator then reports
 * itself unavailable instead of failing.
 */
@Slf4j
@Component
public class EnglishLexicon {

    public static final String DEFAULT_PATH = "lexicon/en-lexicon.json";

    record LexiconData(
            List<String> nouns,
            List<String> verbs,
            List<String> adjectives,
            List<String> adverbs,
            Map<String, String> irregularVerbs,
            Map<String, String> irregularNouns
    ) {}

    private final boolean loaded;
    private final Set<String> nouns;
    private final Set<String> verbs;
    private final Set<String> adjectives;
    private final Set<String> adverbs;
    private final Map<String, String> irregularVerbs;
    private final Map<String, String> irregularNouns;

    public EnglishLexicon(@Value("${humanizer.lexicon.path:" + DEFAULT_PATH + "}") String resourcePath) {
        LexiconData data = load(resourcePath);
        this.loaded = data != null;
        this.nouns = data != null ? Set.copyOf(data.nouns()) : Set.of();
        this.verbs = data != null ? Set.copyOf(data.verbs()) : Set.of();
        this.adjectives = data != null ? Set.copyOf(data.adjectives()) : Set.of();
        this.adverbs = data != null ? Set.copyOf(data.adverbs()) : Set.of();
        this.irregularVerbs = data != null ? Map.copyOf(data.irregularVerbs()) : Map.of();
        this.irregularNouns = data != null ? Map.copyOf(data.irregularNouns()) : Map.of();
        if (loaded) {
            log.info("[Lexicon] Loaded {}: {} nouns, {} verbs, {} adjectives, {} adverbs",
                    resourcePath, nouns.size(), verbs.size(), adjectives.size(), adverbs.size());
        }
    }

    private static LexiconData load(String resourcePath) {
        try (InputStream in = EnglishLexicon.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (in == null) {
                log.warn("[Lexicon] Resource not found: {} (annotation disabled)", resourcePath);
                return null;
            }
            return new ObjectMapper().readValue(in, LexiconData.class);
        } catch (IOException e) {
            log.warn("[Lexicon] Failed to read {} (annotation disabled)", resourcePath, e);
            return null;
        }
    }

    public boolean isLoaded() {
        return loaded;
    }

    public boolean isNoun(String lower) {
        return nouns.contains(lower);
    }

    public boolean isVerb(String lower) {
        return verbs.contains(lower);
    }

    public boolean isAdjective(String lower) {
        return adjectives.contains(lower);
    }

    public boolean isAdverb(String lower) {
        return adverbs.contains(lower);
    }

    public String irregularVerbLemma(String lower) {
        return irregularVerbs.get(lower);
    }

    public String irregularNounLemma(String lower) {
        return irregularNouns.get(lower);
    }
}
