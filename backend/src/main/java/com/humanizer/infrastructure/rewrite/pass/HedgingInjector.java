package com.humanizer.infrastructure.rewrite.pass;

import com.humanizer.domain.language.model.Annotation;
import com.humanizer.domain.language.model.DependencyRole;
import com.humanizer.domain.language.model.PartOfSpeech;
import com.humanizer.domain.language.model.Token;
import com.humanizer.domain.language.service.LinguisticAnnotator;
import com.humanizer.domain.rewrite.model.SubjectType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Softens absolute claims with one hedge per sentence.
 *
 * Gates (any one skips the sentence):
 *   1. fewer than 4 words, a question, an imperative, a citation placeholder,
 *      technical vocabulary, a definition or arithmetic, a measurement with a unit or a clock time
 *   2. technical subject making a hard guarantee ("The protocol guarantees delivery.")
 *
 * Then each {@link HedgeStrategy} in order gets its own coin-flip; the first that applies wins.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HedgingInjector {

    static final int MIN_WORDS = 4;

    private static final Map<String, String> STRONG_VERBS = Map.ofEntries(
            Map.entry("proves", "suggests"), Map.entry("prove", "suggest"),
            Map.entry("shows", "seems to show"), Map.entry("show", "seem to show"),
            Map.entry("demonstrates", "appears to demonstrate"), Map.entry("demonstrate", "appear to demonstrate"),
            Map.entry("confirms", "supports"), Map.entry("confirm", "support"),
            Map.entry("establishes", "suggests"), Map.entry("establish", "suggest"),
            Map.entry("guarantees", "helps ensure"), Map.entry("guarantee", "help ensure"),
            Map.entry("ensures", "helps ensure"), Map.entry("ensure", "help ensure"),
            Map.entry("eliminates", "reduces"), Map.entry("eliminate", "reduce"),
            Map.entry("causes", "can cause"), Map.entry("cause", "can cause"),
            Map.entry("will", "may"), Map.entry("must", "should")
    );

    private static final List<String> FREQUENCY_ADVERBS = List.of(
            "often", "generally", "typically", "usually", "frequently", "commonly");

    private static final List<String> APPROXIMATORS = List.of(
            "relatively", "fairly", "rather", "somewhat", "quite", "largely");

    private static final Set<String> STRONG_ADJECTIVES = Set.of(
            "significant", "important", "critical", "essential", "major", "crucial", "substantial", "vital",
            "effective", "efficient", "accurate", "reliable", "successful", "strong", "clear", "fast", "large",
            "high", "difficult", "complex", "simple", "easy", "common", "popular", "useful", "powerful"
    );

    private static final List<String> EPISTEMIC_ADVERBS = List.of(
            "arguably", "likely", "probably", "apparently", "seemingly", "possibly");

    private static final List<String> SCOPE_LIMITERS = List.of(
            "In many cases,", "In most contexts,", "Under typical conditions,", "For the most part,",
            "In general,", "To some extent,");

    private static final Set<String> TECHNICAL_INDICATORS = Set.of(
            "syntax", "runtime", "bytecode", "parameter", "parameters", "variable", "variables", "boolean",
            "array", "arrays", "thread", "threads", "http", "https", "json", "xml", "sql", "regex", "hash",
            "pointer", "recursion", "compiler", "integer", "byte", "bytes", "cpu", "gpu", "latency", "null",
            "stack", "heap", "mutex", "socket", "endpoint", "url", "tcp", "udp", "git"
    );

    private static final Set<String> TECHNICAL_SUBJECTS = Set.of(
            "system", "api", "algorithm", "protocol", "database", "server", "library", "framework", "function",
            "method", "compiler", "code", "software", "program", "application", "module", "service", "interface"
    );

    private static final Set<String> RESEARCH_SUBJECTS = Set.of(
            "study", "research", "finding", "result", "data", "evidence", "experiment", "analysis", "paper",
            "survey", "trial", "researcher", "author"
    );

    // a screen "shows" the time, a map "shows" a route: literal display, not a claim
    private static final Set<String> DISPLAY_SUBJECTS = Set.of(
            "screen", "display", "map", "chart", "graph", "figure", "table", "dashboard", "monitor", "sign",
            "clock", "window", "page", "photo", "picture", "image", "video", "label"
    );

    private static final Pattern TIME_ANCHOR = Pattern.compile(
            "\\b(yesterday|today|tonight|tomorrow|last (week|month|year|night)|this (morning|week|year)|"
                    + "on (monday|tuesday|wednesday|thursday|friday|saturday|sunday)|in (19|20)\\d{2})\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern STRONG_GUARANTEE = Pattern.compile(
            "\\b(guarantee[sd]?|ensure[sd]?|require[sd]?)\\b", Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> DEFINITIONAL_PATTERNS = List.of(
            Pattern.compile("\\b(is|are) defined as\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\brefers? to\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(is|are) known as\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bstands? for\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(is|are) equal to\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bequals\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\d+(?:\\.\\d+)?\\s*[+\\-*/×÷=]\\s*\\d+")
    );

    private static final Pattern MEASUREMENT = Pattern.compile(
            "\\d+(?:[.,]\\d+)?\\s*(?:%|°|percent\\b|degrees?\\b|celsius\\b|fahrenheit\\b|kelvin\\b|"
                    + "k?g\\b|mg\\b|lbs?\\b|pounds?\\b|ounces?\\b|km\\b|cm\\b|mm\\b|m\\b|meters?\\b|metres?\\b|"
                    + "kilometers?\\b|miles?\\b|feet\\b|inch(?:es)?\\b|ml\\b|l\\b|liters?\\b|litres?\\b|"
                    + "hours?\\b|minutes?\\b|seconds?\\b|ms\\b|days?\\b|weeks?\\b|years?\\b|"
                    + "[kmgt]b\\b|[kmg]hz\\b|hz\\b|kw\\b|watts?\\b|volts?\\b|mph\\b|km/h)"
                    + "|\\b\\d{1,2}(?::\\d{2})?\\s*(?:am|pm|a\\.m\\.|p\\.m\\.)(?![A-Za-z])",
            Pattern.CASE_INSENSITIVE);

    private static final Set<String> BE_FORMS = Set.of("is", "are", "was", "were", "be", "been", "am");

    private final LinguisticAnnotator annotator;
    private final DiscourseMarkers markers;

    public String hedge(String sentence, double probability, Random random) {
        if (sentence == null || sentence.isBlank() || !annotator.isAvailable()) {
            return sentence;
        }
        if (random.nextDouble() >= probability) {
            return sentence;
        }
        if (skipsGlobally(sentence)) {
            return sentence;
        }

        Annotation annotation = annotator.annotate(sentence);
        if (opensWithImperative(annotation)) {
            return sentence;
        }
        SubjectType subjectType = classifySubject(annotation);
        if (subjectType == SubjectType.TECHNICAL && STRONG_GUARANTEE.matcher(sentence).find()) {
            log.debug("[Hedging] Skipped technical guarantee: '{}'", sentence);
            return sentence;
        }

        for (HedgeStrategy strategy : HedgeStrategy.values()) {
            if (random.nextDouble() >= strategy.triggerProbability()) {
                continue;
            }
            Optional<String> hedged = switch (strategy) {
                case MODAL_SUBSTITUTION -> substituteModal(sentence, annotation);
                case FREQUENCY_ADVERB -> insertFrequencyAdverb(sentence, annotation, random);
                case APPROXIMATOR -> insertApproximator(sentence, annotation, random);
                case EPISTEMIC_ADVERB -> insertEpistemicAdverb(sentence, annotation, random);
                case SCOPE_LIMITER -> prefixScopeLimiter(sentence, annotation, random);
            };
            if (hedged.isPresent()) {
                log.debug("[Hedging] {} ({} subject)", strategy, subjectType);
                return hedged.get();
            }
        }
        return sentence;
    }

    // ── Gate 1 ──

    boolean skipsGlobally(String sentence) {
        if (SentenceText.wordCount(sentence) < MIN_WORDS || SentenceText.isQuestion(sentence)) {
            return true;
        }
        if (SentenceText.containsPlaceholder(sentence)) {
            return true;
        }
        for (String word : sentence.toLowerCase(Locale.ROOT).split("[^a-z]+")) {
            if (TECHNICAL_INDICATORS.contains(word)) {
                return true;
            }
        }
        for (Pattern p : DEFINITIONAL_PATTERNS) {
            if (p.matcher(sentence).find()) {
                return true;
            }
        }
        return MEASUREMENT.matcher(sentence).find();
    }

    private static boolean opensWithImperative(Annotation annotation) {
        return annotation.firstWord()
                .map(t -> t.pos() == PartOfSpeech.VERB && t.lower().equals(t.lemma()))
                .orElse(false);
    }

    // ── Gate 2 ──

    SubjectType classifySubject(Annotation annotation) {
        Optional<Token> subject = annotation.subject();
        if (subject.isEmpty()) {
            return SubjectType.GENERAL;
        }
        String lemma = subject.get().lemma();
        if (TECHNICAL_SUBJECTS.contains(lemma)) {
            return SubjectType.TECHNICAL;
        }
        if (RESEARCH_SUBJECTS.contains(lemma)) {
            return SubjectType.RESEARCH;
        }
        return SubjectType.GENERAL;
    }

    private boolean isLiteralUsage(String sentence, Annotation annotation) {
        if (annotation.subject().map(s -> DISPLAY_SUBJECTS.contains(s.lemma())).orElse(false)) {
            return true;
        }
        return TIME_ANCHOR.matcher(sentence).find();
    }

    // ── Strategies ──

    private Optional<String> substituteModal(String sentence, Annotation annotation) {
        if (isLiteralUsage(sentence, annotation)) {
            return Optional.empty();
        }
        for (Token token : annotation.tokens()) {
            String softer = STRONG_VERBS.get(token.lower());
            if (softer == null) {
                continue;
            }
            boolean finiteVerb = token.pos() == PartOfSpeech.VERB && token.depRole() == DependencyRole.ROOT;
            boolean modal = token.pos() == PartOfSpeech.AUX && isFollowedByVerb(annotation, token);
            if (finiteVerb || modal) {
                return Optional.of(splice(sentence, token.start(), token.end(), matchCase(token.text(), softer)));
            }
        }
        return Optional.empty();
    }

    private Optional<String> insertFrequencyAdverb(String sentence, Annotation annotation, Random random) {
        if (isLiteralUsage(sentence, annotation) || containsAny(annotation, FREQUENCY_ADVERBS)) {
            return Optional.empty();
        }
        Optional<Token> root = annotation.root();
        if (root.isEmpty() || root.get().pos() != PartOfSpeech.VERB || root.get().index() == 0) {
            return Optional.empty();
        }
        Token verb = root.get();
        Token before = annotation.previous(verb);
        if (before == null || before.pos() == PartOfSpeech.ADV || before.pos() == PartOfSpeech.AUX
                || before.pos() == PartOfSpeech.PART || isPastTense(verb)) {
            return Optional.empty();
        }
        String adverb = FREQUENCY_ADVERBS.get(random.nextInt(FREQUENCY_ADVERBS.size()));
        return Optional.of(splice(sentence, verb.start(), verb.start(), adverb + " "));
    }

    private Optional<String> insertApproximator(String sentence, Annotation annotation, Random random) {
        for (Token token : annotation.tokens()) {
            if (token.pos() != PartOfSpeech.ADJ || !STRONG_ADJECTIVES.contains(token.lower())) {
                continue;
            }
            Token before = annotation.previous(token);
            if (before != null && (before.pos() == PartOfSpeech.ADV || Set.of("most", "more", "less", "least")
                    .contains(before.lower()))) {
                continue;
            }
            if (before != null && before.lower().equals("an")) {
                // "an important" would become "an relatively important"
                continue;
            }
            String approximator = APPROXIMATORS.get(random.nextInt(APPROXIMATORS.size()));
            String inserted = token.index() == firstWordIndex(annotation)
                    ? capitalize(approximator) + " " + Character.toLowerCase(token.text().charAt(0)) + token.text().substring(1)
                    : approximator + " " + token.text();
            return Optional.of(splice(sentence, token.start(), token.end(), inserted));
        }
        return Optional.empty();
    }

    private Optional<String> insertEpistemicAdverb(String sentence, Annotation annotation, Random random) {
        if (containsAny(annotation, EPISTEMIC_ADVERBS)) {
            return Optional.empty();
        }
        Optional<Token> root = annotation.root();
        if (root.isEmpty() || root.get().index() == 0) {
            return Optional.empty();
        }
        Token verb = root.get();
        String adverb = EPISTEMIC_ADVERBS.get(random.nextInt(EPISTEMIC_ADVERBS.size()));

        // copula: "is probably fast"
        if (verb.pos() == PartOfSpeech.AUX && BE_FORMS.contains(verb.lower())) {
            Token after = annotation.next(verb);
            if (after == null || after.pos() == PartOfSpeech.PUNCT || after.lower().equals("not")) {
                return Optional.empty();
            }
            return Optional.of(splice(sentence, verb.end(), verb.end(), " " + adverb));
        }
        if (verb.pos() != PartOfSpeech.VERB) {
            return Optional.empty();
        }
        Token before = annotation.previous(verb);
        if (before != null && before.pos() == PartOfSpeech.AUX) {
            // "has probably improved"
            return Optional.of(splice(sentence, before.end(), before.end(), " " + adverb));
        }
        if (before == null || before.pos() == PartOfSpeech.ADV || before.pos() == PartOfSpeech.PART) {
            return Optional.empty();
        }
        return Optional.of(splice(sentence, verb.start(), verb.start(), adverb + " "));
    }

    private Optional<String> prefixScopeLimiter(String sentence, Annotation annotation, Random random) {
        if (opensWithHedge(sentence) || markers.opensWithMarker(sentence) || SentenceText.startsWithPlaceholder(sentence)) {
            return Optional.empty();
        }
        String limiter = SCOPE_LIMITERS.get(random.nextInt(SCOPE_LIMITERS.size()));
        boolean properNoun = annotation.firstWord().map(t -> t.pos() == PartOfSpeech.PROPN).orElse(false);
        return Optional.of(limiter + " " + SentenceText.lowercaseFirst(sentence.stripLeading(), properNoun));
    }

    private static boolean opensWithHedge(String sentence) {
        for (String limiter : SCOPE_LIMITERS) {
            if (SentenceText.opensWith(sentence, limiter.substring(0, limiter.length() - 1))) {
                return true;
            }
        }
        String first = SentenceText.firstWord(sentence);
        return EPISTEMIC_ADVERBS.contains(first) || FREQUENCY_ADVERBS.contains(first)
                || Set.of("perhaps", "maybe", "possibly", "presumably").contains(first);
    }

    // ── Helpers ──

    private static boolean isFollowedByVerb(Annotation annotation, Token token) {
        Token next = annotation.next(token);
        while (next != null && (next.pos() == PartOfSpeech.ADV || next.lower().equals("not"))) {
            next = annotation.next(next);
        }
        return next != null && (next.pos() == PartOfSpeech.VERB || next.pos() == PartOfSpeech.AUX);
    }

    private static boolean isPastTense(Token verb) {
        return !verb.lower().equals(verb.lemma()) && !verb.lower().endsWith("s");
    }

    private static boolean containsAny(Annotation annotation, List<String> words) {
        return annotation.tokens().stream().anyMatch(t -> words.contains(t.lower()));
    }

    private static int firstWordIndex(Annotation annotation) {
        return annotation.firstWord().map(Token::index).orElse(-1);
    }

    private static String splice(String sentence, int start, int end, String replacement) {
        return sentence.substring(0, start) + replacement + sentence.substring(end);
    }

    private static String matchCase(String original, String replacement) {
        return Character.isUpperCase(original.charAt(0)) ? capitalize(replacement) : replacement;
    }

    private static String capitalize(String word) {
        return Character.toUpperCase(word.charAt(0)) + word.substring(1);
    }
}
