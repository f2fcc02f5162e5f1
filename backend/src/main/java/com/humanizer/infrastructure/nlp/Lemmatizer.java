package com.humanizer.infrastructure.nlp;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Maps inflected English nouns and verbs back to their dictionary form using suffix
 * stripping confirmed against the lexicon.
 */
@Component
@RequiredArgsConstructor
public class Lemmatizer {

    private final EnglishLexicon lexicon;

    public Optional<String> verbLemma(String lower) {
        String irregular = lexicon.irregularVerbLemma(lower);
        if (irregular != null) {
            return Optional.of(irregular);
        }
        if (lexicon.isVerb(lower)) {
            return Optional.of(lower);
        }
        if (lower.endsWith("ies") && lower.length() > 4) {
            return verb(lower.substring(0, lower.length() - 3) + "y");
        }
        if (lower.endsWith("ied") && lower.length() > 4) {
            return verb(lower.substring(0, lower.length() - 3) + "y");
        }
        if (lower.endsWith("es") && lower.length() > 3) {
            Optional<String> stem = verb(lower.substring(0, lower.length() - 2));
            if (stem.isPresent()) {
                return stem;
            }
        }
        if (lower.endsWith("s") && !lower.endsWith("ss") && lower.length() > 2) {
            return verb(lower.substring(0, lower.length() - 1));
        }
        if (lower.endsWith("ed") && lower.length() > 3) {
            return stemVariants(lower.substring(0, lower.length() - 2));
        }
        if (lower.endsWith("ing") && lower.length() > 4) {
            return stemVariants(lower.substring(0, lower.length() - 3));
        }
        return Optional.empty();
    }

    public Optional<String> nounLemma(String lower) {
        String irregular = lexicon.irregularNounLemma(lower);
        if (irregular != null) {
            return Optional.of(irregular);
        }
        if (lexicon.isNoun(lower)) {
            return Optional.of(lower);
        }
        if (lower.endsWith("ies") && lower.length() > 4) {
            return noun(lower.substring(0, lower.length() - 3) + "y");
        }
        if (lower.endsWith("es") && lower.length() > 3) {
            Optional<String> stem = noun(lower.substring(0, lower.length() - 2));
            if (stem.isPresent()) {
                return stem;
            }
        }
        if (lower.endsWith("s") && !lower.endsWith("ss") && lower.length() > 2) {
            return noun(lower.substring(0, lower.length() - 1));
        }
        return Optional.empty();
    }

    // "used" -> us / use, "stopped" -> stopp / stop, "making" -> mak / make
    private Optional<String> stemVariants(String stem) {
        if (lexicon.isVerb(stem)) {
            return Optional.of(stem);
        }
        if (lexicon.isVerb(stem + "e")) {
            return Optional.of(stem + "e");
        }
        int n = stem.length();
        if (n > 2 && stem.charAt(n - 1) == stem.charAt(n - 2) && lexicon.isVerb(stem.substring(0, n - 1))) {
            return Optional.of(stem.substring(0, n - 1));
        }
        if (stem.endsWith("i") && lexicon.isVerb(stem.substring(0, n - 1) + "y")) {
            return Optional.of(stem.substring(0, n - 1) + "y");
        }
        return Optional.empty();
    }

    private Optional<String> verb(String candidate) {
        return lexicon.isVerb(candidate) ? Optional.of(candidate) : Optional.empty();
    }

    private Optional<String> noun(String candidate) {
        return lexicon.isNoun(candidate) ? Optional.of(candidate) : Optional.empty();
    }
}
