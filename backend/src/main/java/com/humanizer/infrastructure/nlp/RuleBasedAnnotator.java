package com.humanizer.infrastructure.nlp;

import com.humanizer.domain.language.exception.AnnotationUnavailableException;
import com.humanizer.domain.language.model.Annotation;
import com.humanizer.domain.language.model.DependencyRole;
import com.humanizer.domain.language.model.EntitySpan;
import com.humanizer.domain.language.model.PartOfSpeech;
import com.humanizer.domain.language.model.Token;
import com.humanizer.domain.language.service.LinguisticAnnotator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.humanizer.domain.language.model.PartOfSpeech.*;

/**
 * Lexicon- and heuristic-driven English annotator. No statistical model.
 *
 * Stages:
 *   1. Tokenize (citation placeholders, words with internal apostrophes/hyphens, numbers, symbols)
 *   2. Tag closed-class words from fixed tables, contractions by their host word
 *   3. Tag open-class words from lexicon candidates, disambiguated by the previous tag
 *   4. Assign dependency roles (root, subject, auxiliaries, objects, modifiers) from the tag sequence
 *   5. Lemmatize and collect runs of proper nouns as entities
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RuleBasedAnnotator implements LinguisticAnnotator {

    private final EnglishLexicon lexicon;
    private final Lemmatizer lemmatizer;

    private record RawToken(String text, String lower, int start, int end) {}

    private static final Pattern PLACEHOLDER = Pattern.compile("\\[\\s*\\[\\s*REF_\\d+\\s*\\]\\s*\\]");

    private static final Pattern TOKEN_PATTERN = Pattern.compile(
            PLACEHOLDER.pattern()
                    + "|[A-Za-z]+(?:['’\\-][A-Za-z]+)*"
                    + "|\\d+(?:[.,:]\\d+)*%?"
                    + "|\\S"
    );

    static final Set<String> BE_FORMS = Set.of("be", "am", "is", "are", "was", "were", "been", "being");
    static final Set<String> HAVE_FORMS = Set.of("have", "has", "had", "having");
    static final Set<String> DO_FORMS = Set.of("do", "does", "did");
    static final Set<String> MODALS = Set.of(
            "can", "could", "may", "might", "must", "shall", "should", "will", "would", "ought", "cannot");

    private static final Set<String> DEMONSTRATIVES = Set.of("this", "that", "these", "those");

    private static final Set<String> POSSESSIVES = Set.of("my", "your", "his", "her", "its", "our", "their");

    private static final Set<String> INTERJECTIONS = Set.of(
            "yes", "oh", "ah", "hello", "hi", "okay", "ok", "wow", "hey", "thanks", "yeah");

    private static final Map<String, PartOfSpeech> CLOSED_CLASS = new HashMap<>();

    static {
        for (String w : List.of("the", "a", "an", "each", "every", "some", "any", "all", "both", "either",
                "neither", "another", "such", "much", "many", "few", "several", "most", "more", "less", "fewer",
                "whose", "my", "your", "his", "her", "its", "our", "their", "no")) {
            CLOSED_CLASS.put(w, DET);
        }
        for (String w : List.of("i", "me", "you", "he", "him", "she", "it", "we", "us", "they", "them",
                "myself", "yourself", "himself", "herself", "itself", "ourselves", "themselves", "who", "whom",
                "which", "what", "something", "anything", "nothing", "everything", "someone", "anyone",
                "everyone", "nobody", "somebody", "everybody", "mine", "yours", "hers", "ours", "theirs")) {
            CLOSED_CLASS.put(w, PRON);
        }
        for (String w : List.of("of", "in", "on", "at", "by", "for", "with", "about", "against", "between",
                "into", "through", "during", "before", "after", "above", "below", "from", "up", "down", "over",
                "under", "across", "within", "without", "throughout", "among", "around", "behind", "beyond",
                "near", "toward", "towards", "upon", "via", "per", "like", "than", "despite", "except", "along",
                "inside", "outside", "onto", "beside", "besides", "as", "unlike")) {
            CLOSED_CLASS.put(w, ADP);
        }
        for (String w : List.of("and", "or", "but", "nor")) {
            CLOSED_CLASS.put(w, CCONJ);
        }
        for (String w : List.of("because", "although", "though", "while", "whereas", "if", "unless", "since",
                "until", "whether", "once", "when", "where", "how", "why")) {
            CLOSED_CLASS.put(w, SCONJ);
        }
        for (String w : List.of("not", "to")) {
            CLOSED_CLASS.put(w, PART);
        }
        for (String w : List.of("very", "too", "also", "just", "only", "even", "still", "already", "always",
                "never", "often", "sometimes", "usually", "generally", "typically", "rarely", "seldom",
                "frequently", "here", "there", "now", "then", "today", "soon", "quite", "rather", "really",
                "almost", "however", "therefore", "thus", "hence", "moreover", "furthermore", "meanwhile",
                "nevertheless", "nonetheless", "instead", "perhaps", "maybe", "probably", "possibly",
                "certainly", "indeed", "again", "ever", "yet", "so", "else", "well", "finally", "consequently",
                "accordingly", "additionally", "arguably", "apparently", "somewhat", "fairly", "relatively",
                "largely", "mostly", "clearly", "obviously", "definitely", "otherwise", "likewise", "similarly",
                "namely", "anyway", "besides", "together", "away", "back", "later", "earlier", "once")) {
            CLOSED_CLASS.putIfAbsent(w, ADV);
        }
        for (String w : BE_FORMS) {
            CLOSED_CLASS.put(w, AUX);
        }
        for (String w : MODALS) {
            CLOSED_CLASS.put(w, AUX);
        }
    }

    private static final Map<String, String> NEGATED_AUX_LEMMAS = Map.ofEntries(
            Map.entry("can't", "can"), Map.entry("won't", "will"), Map.entry("shan't", "shall"),
            Map.entry("don't", "do"), Map.entry("doesn't", "do"), Map.entry("didn't", "do"),
            Map.entry("isn't", "be"), Map.entry("aren't", "be"), Map.entry("wasn't", "be"),
            Map.entry("weren't", "be"), Map.entry("haven't", "have"), Map.entry("hasn't", "have"),
            Map.entry("hadn't", "have"), Map.entry("shouldn't", "should"), Map.entry("couldn't", "could"),
            Map.entry("wouldn't", "would"), Map.entry("mustn't", "must"), Map.entry("mightn't", "might"),
            Map.entry("needn't", "need")
    );

    @Override
    public boolean isAvailable() {
        return lexicon.isLoaded();
    }

    @Override
    public Annotation annotate(String sentence) {
        if (!isAvailable()) {
            throw new AnnotationUnavailableException("English lexicon is not loaded");
        }
        if (sentence == null || sentence.isBlank()) {
            return new Annotation(sentence == null ? "" : sentence, List.of(), List.of());
        }

        List<RawToken> raw = tokenize(sentence);
        int n = raw.size();

        PartOfSpeech[] tags = new PartOfSpeech[n];
        boolean seenVerb = false;
        for (int i = 0; i < n; i++) {
            tags[i] = tag(raw, tags, i, seenVerb);
            if (tags[i] == VERB) {
                seenVerb = true;
            }
        }

        DependencyRole[] roles = assignRoles(raw, tags);

        List<Token> tokens = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            RawToken t = raw.get(i);
            tokens.add(new Token(t.text(), tags[i], roles[i], lemma(t, tags[i]), i, t.start(), t.end()));
        }

        Annotation annotation = new Annotation(sentence, List.copyOf(tokens), collectEntities(sentence, tokens));
        if (log.isTraceEnabled()) {
            log.trace("[Annotator] {}", tokens.stream().map(t -> t.text() + "/" + t.pos() + "/" + t.depRole()).toList());
        }
        return annotation;
    }

    // ── Stage 1: Tokenize ──

    private List<RawToken> tokenize(String sentence) {
        List<RawToken> tokens = new ArrayList<>();
        Matcher m = TOKEN_PATTERN.matcher(sentence);
        while (m.find()) {
            String text = m.group();
            tokens.add(new RawToken(text, text.toLowerCase(Locale.ROOT).replace('’', '\''), m.start(), m.end()));
        }
        return tokens;
    }

    // ── Stages 2-3: Tagging ──

    private PartOfSpeech tag(List<RawToken> raw, PartOfSpeech[] tags, int i, boolean seenVerb) {
        RawToken token = raw.get(i);
        String text = token.text();
        String lower = token.lower();

        if (PLACEHOLDER.matcher(text).matches()) {
            return X;
        }
        char first = text.charAt(0);
        if (!Character.isLetterOrDigit(first)) {
            return PUNCT;
        }
        if (Character.isDigit(first)) {
            return NUM;
        }

        int prevIndex = previousWordIndex(tags, i);
        PartOfSpeech prev = prevIndex >= 0 ? tags[prevIndex] : null;
        String prevLower = prevIndex >= 0 ? raw.get(prevIndex).lower() : null;
        String next = i + 1 < raw.size() ? raw.get(i + 1).lower() : null;

        if (lower.indexOf('\'') > 0) {
            return tagContraction(lower, text);
        }

        // "I like cats" vs "works like a charm"
        if (lower.equals("like") && !seenVerb && (prev == PRON || prev == NOUN || prev == PROPN || prev == ADV)) {
            return VERB;
        }
        if (DEMONSTRATIVES.contains(lower)) {
            return tagDemonstrative(lower, prev, prevLower, next);
        }
        if (INTERJECTIONS.contains(lower)) {
            return INTJ;
        }
        if (lower.equals("no") && prev == null && (next == null || !Character.isLetter(next.charAt(0)))) {
            return INTJ;
        }
        if (lower.equals("well") && prev == null && ",".equals(next)) {
            return INTJ;
        }
        if (HAVE_FORMS.contains(lower)) {
            return isHaveAuxiliary(next) ? AUX : VERB;
        }
        if (DO_FORMS.contains(lower)) {
            return next != null && (next.equals("not") || CLOSED_CLASS.get(next) == ADV || lexicon.isVerb(next))
                    ? AUX : VERB;
        }
        if (lower.equals("to")) {
            return next != null && lexicon.isVerb(next) && !lexicon.isNoun(next) ? PART : ADP;
        }
        PartOfSpeech closed = CLOSED_CLASS.get(lower);
        if (closed != null) {
            return closed;
        }

        boolean capitalized = Character.isUpperCase(first);
        if (capitalized && text.length() > 1 && text.equals(text.toUpperCase(Locale.ROOT))) {
            return PROPN;
        }
        if (capitalized && prev != null) {
            return PROPN;
        }

        EnumSet<PartOfSpeech> candidates = candidates(lower);
        if (candidates.isEmpty()) {
            if (capitalized) {
                return PROPN;
            }
            candidates = suffixGuess(lower);
        }
        if (candidates.size() == 1) {
            return candidates.iterator().next();
        }
        return disambiguate(candidates, lower, prev, prevLower, next, seenVerb);
    }

    private PartOfSpeech tagContraction(String lower, String text) {
        if (lower.endsWith("n't")) {
            return AUX;
        }
        String host = lower.substring(0, lower.indexOf('\''));
        PartOfSpeech closed = CLOSED_CLASS.get(host);
        if (closed == PRON || DEMONSTRATIVES.contains(host) || host.equals("there") || host.equals("here")) {
            return PRON;
        }
        return Character.isUpperCase(text.charAt(0)) ? PROPN : NOUN;
    }

    private PartOfSpeech tagDemonstrative(String lower, PartOfSpeech prev, String prevLower, String next) {
        if (lower.equals("that") && (prev == VERB || prev == ADJ)) {
            return SCONJ;
        }
        if (lower.equals("that") && (prev == NOUN || prev == PROPN)) {
            return PRON;
        }
        if (next == null || !Character.isLetter(next.charAt(0)) || CLOSED_CLASS.containsKey(next)
                || HAVE_FORMS.contains(next) || DO_FORMS.contains(next)) {
            return PRON;
        }
        // "the problem is that users leave"
        if (lower.equals("that") && prev == AUX && BE_FORMS.contains(prevLower)) {
            return SCONJ;
        }
        boolean nounLike = lemmatizer.nounLemma(next).isPresent() || lexicon.isAdjective(next);
        boolean verbLike = lemmatizer.verbLemma(next).isPresent();
        if (!nounLike) {
            return PRON;
        }
        if (verbLike) {
            boolean plural = next.endsWith("s");
            // "this works" (singular + verb -s) vs "these results" (plural + noun -s)
            if (lower.equals("this") || lower.equals("that")) {
                return plural ? PRON : DET;
            }
            return plural ? DET : PRON;
        }
        return DET;
    }

    private boolean isHaveAuxiliary(String next) {
        if (next == null) {
            return false;
        }
        if (next.equals("not") || next.equals("been") || CLOSED_CLASS.get(next) == ADV) {
            return true;
        }
        String irregular = lexicon.irregularVerbLemma(next);
        if (irregular != null && !lexicon.isVerb(next)) {
            return true;
        }
        return next.endsWith("ed") && lemmatizer.verbLemma(next).isPresent();
    }

    private EnumSet<PartOfSpeech> candidates(String lower) {
        EnumSet<PartOfSpeech> result = EnumSet.noneOf(PartOfSpeech.class);
        if (lemmatizer.nounLemma(lower).isPresent()) {
            result.add(NOUN);
        }
        if (lemmatizer.verbLemma(lower).isPresent()) {
            result.add(VERB);
        }
        if (lexicon.isAdjective(lower)) {
            result.add(ADJ);
        }
        if (lexicon.isAdverb(lower) || (result.isEmpty() && lower.endsWith("ly") && lower.length() > 4)) {
            result.add(ADV);
        }
        return result;
    }

    private static EnumSet<PartOfSpeech> suffixGuess(String lower) {
        if (lower.matches(".+(tion|sion|ment|ness|ity|ism|ist|ance|ence|ship|hood|ogy|age|ers|ors)")) {
            return EnumSet.of(NOUN);
        }
        if (lower.matches(".+(ous|ful|ive|able|ible|al|ic|less|ish|ary|ant|ent)")) {
            return EnumSet.of(ADJ);
        }
        if (lower.matches(".+(ize|ise|ify|ate|ed|ing)")) {
            return EnumSet.of(VERB);
        }
        return EnumSet.of(NOUN);
    }

    private PartOfSpeech disambiguate(EnumSet<PartOfSpeech> candidates, String lower, PartOfSpeech prev,
                                      String prevLower, String next, boolean seenVerb) {
        if (prev == DET || prev == NUM || (prevLower != null && POSSESSIVES.contains(prevLower))) {
            if (candidates.contains(ADJ) && nextLooksNominal(next)) return ADJ;
            if (candidates.contains(NOUN)) return NOUN;
            if (candidates.contains(ADJ)) return ADJ;
        }
        if (prev == ADJ) {
            if (candidates.contains(NOUN)) return NOUN;
            if (candidates.contains(ADJ)) return ADJ;
        }
        if (prev == PART || (prev == AUX && (MODALS.contains(prevLower) || DO_FORMS.contains(prevLower)
                || prevLower.endsWith("n't")))) {
            if (candidates.contains(VERB)) return VERB;
        }
        if (prev == AUX) {
            if (candidates.contains(VERB) && isParticipleOrGerund(lower)) return VERB;
            if (candidates.contains(ADJ)) return ADJ;
        }
        if (!seenVerb && candidates.contains(VERB)) {
            if (prev == PRON || prev == ADV) return VERB;
            if ((prev == NOUN || prev == PROPN) && !isAuxiliaryForm(next)) return VERB;
        }
        if (prev == ADP) {
            if (candidates.contains(NOUN)) return NOUN;
            if (candidates.contains(ADJ) && nextLooksNominal(next)) return ADJ;
        }
        if (prev == null && candidates.contains(VERB) && lexicon.isVerb(lower) && startsObject(next)) {
            return VERB;
        }
        if (prev == VERB) {
            if (candidates.contains(ADJ) && nextLooksNominal(next)) return ADJ;
            if (candidates.contains(NOUN)) return NOUN;
        }
        for (PartOfSpeech preferred : List.of(NOUN, VERB, ADJ, ADV)) {
            if (candidates.contains(preferred)) {
                return preferred;
            }
        }
        return NOUN;
    }

    private boolean nextLooksNominal(String next) {
        if (next == null || CLOSED_CLASS.containsKey(next) || !Character.isLetter(next.charAt(0))) {
            return false;
        }
        return lemmatizer.nounLemma(next).isPresent() || lexicon.isAdjective(next);
    }

    private static boolean isAuxiliaryForm(String next) {
        return next != null && (BE_FORMS.contains(next) || MODALS.contains(next)
                || HAVE_FORMS.contains(next) || DO_FORMS.contains(next));
    }

    private static boolean startsObject(String next) {
        return next != null && (CLOSED_CLASS.get(next) == DET || DEMONSTRATIVES.contains(next)
                || Set.of("me", "us", "them", "it", "him", "her", "yourself").contains(next));
    }

    private boolean isParticipleOrGerund(String lower) {
        if (lower.endsWith("ed") || lower.endsWith("en") || lower.endsWith("ing")) {
            return true;
        }
        return lexicon.irregularVerbLemma(lower) != null && !lexicon.isVerb(lower);
    }

    private static int previousWordIndex(PartOfSpeech[] tags, int i) {
        for (int j = i - 1; j >= 0; j--) {
            if (tags[j] == PUNCT) {
                // a comma or quote does not reset context, a sentence-internal colon or dash does not either
                continue;
            }
            return j;
        }
        return -1;
    }

    // ── Stage 4: Dependency roles ──

    private DependencyRole[] assignRoles(List<RawToken> raw, PartOfSpeech[] tags) {
        int n = tags.length;
        DependencyRole[] roles = new DependencyRole[n];

        // a copula ahead of a subordinator is the main verb: "the problem is that users leave"
        int root = -1;
        int copula = -1;
        for (int i = 0; i < n && root < 0; i++) {
            if (tags[i] == VERB && !(i > 0 && tags[i - 1] == PART)) {
                root = i;
            } else if (tags[i] == AUX && copula < 0 && BE_FORMS.contains(raw.get(i).lower())) {
                copula = i;
            } else if (tags[i] == SCONJ && copula >= 0) {
                root = copula;
            }
        }
        if (root < 0) {
            for (int i = 0; i < n && root < 0; i++) {
                if (tags[i] == AUX) {
                    root = i;
                }
            }
        }

        boolean sawSubordinator = false;
        for (int i = 0; i < n; i++) {
            roles[i] = switch (tags[i]) {
                case PUNCT -> DependencyRole.PUNCT;
                case DET -> DependencyRole.DET;
                case ADP -> DependencyRole.PREP;
                case ADV -> DependencyRole.ADVMOD;
                case CCONJ -> DependencyRole.CC;
                case SCONJ -> DependencyRole.MARK;
                case AUX -> DependencyRole.AUX;
                case ADJ -> i + 1 < n && (tags[i + 1] == NOUN || tags[i + 1] == PROPN || tags[i + 1] == ADJ)
                        ? DependencyRole.AMOD : DependencyRole.ACOMP;
                case NOUN -> i + 1 < n && tags[i + 1] == NOUN ? DependencyRole.COMPOUND : DependencyRole.DEP;
                case VERB -> root >= 0 && i > root && sawSubordinator ? DependencyRole.CCOMP : DependencyRole.DEP;
                default -> DependencyRole.DEP;
            };
            if (tags[i] == SCONJ && root >= 0 && i > root) {
                sawSubordinator = true;
            }
        }
        if (root < 0) {
            return roles;
        }
        roles[root] = DependencyRole.ROOT;

        boolean subjectFound = false;
        boolean objectFound = false;
        int i = 0;
        while (i < n) {
            if (!isNounPhraseStart(tags[i])) {
                i++;
                continue;
            }
            int start = i;
            int head = -1;
            if (tags[i] == PRON) {
                head = i;
                i++;
            } else {
                while (i < n && isNounPhrasePart(tags[i])) {
                    if (tags[i] == NOUN || tags[i] == PROPN) {
                        head = i;
                    }
                    i++;
                }
            }
            if (head < 0) {
                continue;
            }
            int before = previousWordIndex(tags, start);
            boolean governedByPreposition = before >= 0 && (tags[before] == ADP || tags[before] == PART);
            if (governedByPreposition) {
                roles[head] = DependencyRole.POBJ;
            } else if (head < root && !subjectFound) {
                roles[head] = DependencyRole.NSUBJ;
                subjectFound = true;
            } else if (head > root && !objectFound && tags[root] == VERB) {
                roles[head] = DependencyRole.DOBJ;
                objectFound = true;
            }
        }
        return roles;
    }

    private static boolean isNounPhraseStart(PartOfSpeech tag) {
        return tag == DET || tag == ADJ || tag == NOUN || tag == PROPN || tag == PRON || tag == NUM;
    }

    private static boolean isNounPhrasePart(PartOfSpeech tag) {
        return tag == DET || tag == ADJ || tag == NOUN || tag == PROPN || tag == NUM;
    }

    // ── Stage 5: Lemmas and entities ──

    private String lemma(RawToken token, PartOfSpeech tag) {
        String lower = token.lower();
        return switch (tag) {
            case NOUN -> lemmatizer.nounLemma(lower).orElse(lower);
            case VERB -> lemmatizer.verbLemma(lower).orElse(lower);
            case AUX -> {
                if (NEGATED_AUX_LEMMAS.containsKey(lower)) yield NEGATED_AUX_LEMMAS.get(lower);
                if (BE_FORMS.contains(lower)) yield "be";
                if (HAVE_FORMS.contains(lower)) yield "have";
                if (DO_FORMS.contains(lower)) yield "do";
                yield lower;
            }
            default -> lower;
        };
    }

    private static List<EntitySpan> collectEntities(String sentence, List<Token> tokens) {
        List<EntitySpan> entities = new ArrayList<>();
        int start = -1;
        int end = -1;
        for (Token token : tokens) {
            if (token.pos() == PROPN) {
                if (start < 0) {
                    start = token.start();
                }
                end = token.end();
            } else if (start >= 0) {
                entities.add(new EntitySpan(sentence.substring(start, end), start, end));
                start = -1;
            }
        }
        if (start >= 0) {
            entities.add(new EntitySpan(sentence.substring(start, end), start, end));
        }
        return List.copyOf(entities);
    }
}
