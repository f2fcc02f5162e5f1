package com.humanizer.infrastructure.rewrite.pass;

import com.humanizer.domain.language.model.Annotation;
import com.humanizer.domain.language.model.PartOfSpeech;
import com.humanizer.domain.language.model.Token;
import com.humanizer.domain.language.service.LinguisticAnnotator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Fronts a trailing prepositional phrase:
 * "The team reviewed the results in the morning." → "In the morning, the team reviewed the results."
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClauseReorderer {

    static final int MIN_PHRASE_WORDS = 2;
    static final int MAX_PHRASE_WORDS = 5;
    static final int MIN_REMAINING_WORDS = 4;

    // prepositions whose phrase belongs to the word before it
    private static final Set<String> BOUND_PREPOSITIONS = Set.of("of", "to", "than", "like", "as");

    // after a verb, only these read as free adjuncts ("rose in 2020", not "depends on the weather")
    private static final Set<String> ADJUNCT_AFTER_VERB = Set.of(
            "in", "during", "after", "before", "throughout", "within", "across", "over");

    private static final Set<PartOfSpeech> PHRASE_BODY = Set.of(
            PartOfSpeech.DET, PartOfSpeech.ADJ, PartOfSpeech.NOUN, PartOfSpeech.PROPN, PartOfSpeech.NUM);

    private final LinguisticAnnotator annotator;

    /**
     * Reorder with the given probability.
     */
    public String restructure(String sentence, double probability, Random random) {
        if (probability <= 0 || !isCandidate(sentence)) {
            return sentence;
        }
        if (random.nextDouble() >= probability) {
            return sentence;
        }
        return reorder(sentence).orElse(sentence);
    }

    /**
     * The reordered sentence, or empty when it has no movable trailing phrase.
     */
    public Optional<String> reorder(String sentence) {
        if (!isCandidate(sentence)) {
            return Optional.empty();
        }
        Annotation annotation = annotator.annotate(sentence);
        List<Token> tokens = annotation.tokens();

        int end = tokens.size();
        while (end > 0 && tokens.get(end - 1).pos() == PartOfSpeech.PUNCT) {
            end--;
        }
        if (end == 0) {
            return Optional.empty();
        }

        int prep = -1;
        for (int i = end - 1; i > 0; i--) {
            Token t = tokens.get(i);
            if (t.pos() == PartOfSpeech.ADP) {
                prep = i;
                break;
            }
            if (!PHRASE_BODY.contains(t.pos())) {
                return Optional.empty();
            }
        }
        if (prep <= 0) {
            return Optional.empty();
        }

        Token preposition = tokens.get(prep);
        Token head = tokens.get(end - 1);
        Token before = tokens.get(prep - 1);
        int phraseWords = end - prep;
        if (phraseWords < MIN_PHRASE_WORDS || phraseWords > MAX_PHRASE_WORDS
                || BOUND_PREPOSITIONS.contains(preposition.lower())
                || !(head.pos() == PartOfSpeech.NOUN || head.pos() == PartOfSpeech.PROPN || head.pos() == PartOfSpeech.NUM)) {
            return Optional.empty();
        }
        if (before.pos() == PartOfSpeech.VERB && !ADJUNCT_AFTER_VERB.contains(preposition.lower())) {
            return Optional.empty();
        }
        if (!before.isWord()) {
            return Optional.empty();
        }

        String clause = sentence.substring(0, preposition.start()).stripTrailing();
        if (SentenceText.wordCount(clause) < MIN_REMAINING_WORDS) {
            return Optional.empty();
        }
        String phrase = sentence.substring(preposition.start(), head.end());
        String tail = sentence.substring(head.end());

        boolean properNoun = annotation.firstWord().map(t -> t.pos() == PartOfSpeech.PROPN).orElse(false);
        String reordered = SentenceText.capitalizeFirst(phrase) + ", "
                + SentenceText.lowercaseFirst(clause.stripLeading(), properNoun) + tail;
        log.debug("[Reorder] Fronted '{}'", phrase);
        return Optional.of(reordered);
    }

    private boolean isCandidate(String sentence) {
        return sentence != null && !sentence.isBlank() && annotator.isAvailable()
                && sentence.indexOf(',') < 0 && !SentenceText.isQuestion(sentence)
                && !SentenceText.startsWithPlaceholder(sentence);
    }
}
