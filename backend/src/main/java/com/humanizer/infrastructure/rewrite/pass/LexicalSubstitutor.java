package com.humanizer.infrastructure.rewrite.pass;

import com.humanizer.domain.language.model.Annotation;
import com.humanizer.domain.language.model.PartOfSpeech;
import com.humanizer.domain.language.model.SynonymCandidate;
import com.humanizer.domain.language.model.Token;
import com.humanizer.domain.language.service.LexicalRelationProvider;
import com.humanizer.domain.language.service.LinguisticAnnotator;
import com.humanizer.domain.rewrite.model.SynonymFormality;
import com.humanizer.infrastructure.nlp.Inflector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Register-aware synonym replacement of content words.
 *
 * Per eligible token:
 *   1. Coin-flip against the substitution probability
 *   2. Look up synonyms of the lemma for the token's part of speech
 *   3. Filter: no self/same-lemma, single plain word, no digits, at most 5 characters longer
 *   4. Prefer longer (FORMAL) or shorter (CASUAL) candidates when any qualify
 *   5. Rank by frequency, pick randomly among the top 3
 *   6. Carry regular inflection and capitalization over
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LexicalSubstitutor {

    static final int MAX_LENGTH_GROWTH = 5;
    static final int TOP_CANDIDATES = 3;

    private static final Set<PartOfSpeech> SUBSTITUTABLE = Set.of(
            PartOfSpeech.ADJ, PartOfSpeech.NOUN, PartOfSpeech.VERB, PartOfSpeech.ADV);

    private static final Set<String> PROTECTED_TERMS = Set.of(
            "algorithm", "api", "database", "server", "protocol", "function", "variable", "parameter",
            "compiler", "runtime", "syntax", "framework", "library", "module", "interface", "class", "object",
            "method", "array", "string", "integer", "boolean", "thread", "process", "cache", "query", "schema",
            "network", "model", "dataset", "data", "code", "software", "hardware", "kernel", "binary",
            "encryption", "hash", "token", "endpoint", "request", "response", "hypothesis", "theory", "equation",
            "variance", "correlation", "regression", "coefficient", "statistic", "significance", "p-value"
    );

    private static final Set<String> COMMON_WORDS = Set.of(
            // verbs
            "be", "have", "do", "say", "get", "make", "go", "know", "take", "see", "come", "think", "look",
            "want", "give", "use", "find", "tell", "ask", "seem", "feel", "try", "leave", "call", "put", "let",
            // nouns
            "time", "year", "people", "way", "day", "thing", "man", "woman", "life", "child", "world", "part",
            // adjectives
            "good", "new", "first", "last", "long", "great", "little", "own", "other", "old", "right", "big",
            "high", "small", "large", "same", "able", "bad", "next", "few",
            // adverbs
            "very", "also", "just", "only", "even", "still", "now", "then", "so", "well", "really", "always",
            "never", "often", "here", "there", "not", "too"
    );

    private static final Pattern CAMEL_CASE = Pattern.compile(".*[a-z][A-Z].*");
    private static final Pattern HAS_DIGIT = Pattern.compile(".*\\d.*");

    private final LinguisticAnnotator annotator;
    private final LexicalRelationProvider relations;
    private final Inflector inflector;

    public String substitute(String sentence, double probability, SynonymFormality formality, Random random) {
        if (sentence == null || sentence.isBlank() || probability <= 0 || !annotator.isAvailable()) {
            return sentence;
        }

        Annotation annotation = annotator.annotate(sentence);
        Map<Integer, String> replacements = new HashMap<>();

        for (Token token : annotation.tokens()) {
            if (!isEligible(token, formality)) {
                continue;
            }
            if (random.nextDouble() >= probability) {
                continue;
            }
            chooseReplacement(token, formality, random).ifPresent(r -> {
                log.debug("[Substitution] '{}' → '{}'", token.text(), r);
                replacements.put(token.index(), r);
            });
        }

        if (replacements.isEmpty()) {
            return sentence;
        }

        StringBuilder sb = new StringBuilder();
        int lastEnd = 0;
        for (Token token : annotation.tokens()) {
            String replacement = replacements.get(token.index());
            if (replacement != null) {
                sb.append(sentence, lastEnd, token.start());
                sb.append(replacement);
                lastEnd = token.end();
            }
        }
        sb.append(sentence, lastEnd, sentence.length());
        return sb.toString();
    }

    boolean isEligible(Token token, SynonymFormality formality) {
        if (!SUBSTITUTABLE.contains(token.pos())) {
            return false;
        }
        String text = token.text();
        if (SentenceText.PLACEHOLDER.matcher(text).find() || text.indexOf('\'') >= 0 || text.indexOf('’') >= 0) {
            return false;
        }
        if (isProtectedTerm(text, token.lemma())) {
            return false;
        }
        return formality == SynonymFormality.CASUAL || !COMMON_WORDS.contains(token.lemma());
    }

    static boolean isProtectedTerm(String text, String lemma) {
        if (PROTECTED_TERMS.contains(lemma) || PROTECTED_TERMS.contains(text.toLowerCase(Locale.ROOT))) {
            return true;
        }
        if (text.length() > 1 && text.equals(text.toUpperCase(Locale.ROOT))) {
            return true;
        }
        return CAMEL_CASE.matcher(text).matches() || text.contains("_") || HAS_DIGIT.matcher(text).matches();
    }

    private Optional<String> chooseReplacement(Token token, SynonymFormality formality, Random random) {
        String lower = token.lower();
        boolean noun = token.pos() == PartOfSpeech.NOUN;
        Optional<Inflector.Form> form = token.pos() == PartOfSpeech.NOUN || token.pos() == PartOfSpeech.VERB
                ? inflector.detect(lower, token.lemma(), noun)
                : (lower.equals(token.lemma()) ? Optional.of(Inflector.Form.BASE) : Optional.empty());
        if (form.isEmpty()) {
            // irregular or comparative form: leave it
            return Optional.empty();
        }

        List<SynonymCandidate> candidates = filter(relations.synonyms(token.lemma(), token.pos()), token);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        candidates = applyRegister(candidates, token.text().length(), formality);
        candidates.sort(ranking(formality));

        int top = Math.min(TOP_CANDIDATES, candidates.size());
        String chosen = candidates.get(random.nextInt(top)).word();
        String inflected = inflector.inflect(chosen, form.get());
        return Optional.of(matchCapitalization(token.text(), inflected));
    }

    private static List<SynonymCandidate> filter(List<SynonymCandidate> synonyms, Token token) {
        String lower = token.lower();
        List<SynonymCandidate> result = new ArrayList<>();
        for (SynonymCandidate candidate : synonyms) {
            String word = candidate.word().toLowerCase(Locale.ROOT);
            if (word.equals(lower) || word.equals(token.lemma())) {
                continue;
            }
            if (word.contains(" ") || word.contains("-") || word.contains("_") || HAS_DIGIT.matcher(word).matches()) {
                continue;
            }
            if (word.length() > token.text().length() + MAX_LENGTH_GROWTH) {
                continue;
            }
            result.add(new SynonymCandidate(word, candidate.frequency()));
        }
        return result;
    }

    private static List<SynonymCandidate> applyRegister(List<SynonymCandidate> candidates, int originalLength,
                                                        SynonymFormality formality) {
        List<SynonymCandidate> preferred = switch (formality) {
            case FORMAL -> candidates.stream().filter(c -> c.word().length() >= originalLength).toList();
            case CASUAL -> candidates.stream().filter(c -> c.word().length() <= originalLength).toList();
            case NEUTRAL, VARIED -> candidates;
        };
        return new ArrayList<>(preferred.isEmpty() ? candidates : preferred);
    }

    private static Comparator<SynonymCandidate> ranking(SynonymFormality formality) {
        Comparator<SynonymCandidate> byFrequency = Comparator.comparingInt(SynonymCandidate::frequency).reversed();
        Comparator<SynonymCandidate> byLength = Comparator.comparingInt(c -> c.word().length());
        return switch (formality) {
            case FORMAL -> byFrequency.thenComparing(byLength.reversed()).thenComparing(SynonymCandidate::word);
            case CASUAL, NEUTRAL -> byFrequency.thenComparing(byLength).thenComparing(SynonymCandidate::word);
            case VARIED -> byFrequency.thenComparing(SynonymCandidate::word);
        };
    }

    private static String matchCapitalization(String original, String replacement) {
        if (original.length() > 1 && original.equals(original.toUpperCase(Locale.ROOT))) {
            return replacement.toUpperCase(Locale.ROOT);
        }
        if (Character.isUpperCase(original.charAt(0))) {
            return Character.toUpperCase(replacement.charAt(0)) + replacement.substring(1);
        }
        return replacement;
    }
}
