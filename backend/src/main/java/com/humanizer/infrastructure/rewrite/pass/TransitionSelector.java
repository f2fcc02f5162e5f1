package com.humanizer.infrastructure.rewrite.pass;

import com.humanizer.domain.language.model.PartOfSpeech;
import com.humanizer.domain.language.service.LinguisticAnnotator;
import com.humanizer.domain.rewrite.model.SentenceRelationship;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Random;

/**
 * Prefixes a sentence with a transition phrase matched to its relationship with the previous sentence,
 * avoiding phrases used in the last few sentences.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TransitionSelector {

    private final TransitionCatalog catalog;
    private final DiscourseMarkers markers;
    private final SentenceRelationshipClassifier classifier;
    private final LinguisticAnnotator annotator;

    /**
     * @param sentence         the sentence to prefix
     * @param previousSentence its predecessor, or null for the first sentence of the text
     * @param memory           recent phrases of this call, updated on success
     * @param probability      chance of adding a transition
     * @param style            transition-catalog key
     */
    public String addTransition(String sentence, String previousSentence, TransitionMemory memory,
                                double probability, String style, Random random) {
        if (previousSentence == null || sentence == null || sentence.isBlank()) {
            return sentence;
        }
        if (markers.opensWithMarker(sentence)) {
            return sentence;
        }
        if (random.nextDouble() >= probability) {
            return sentence;
        }

        SentenceRelationship relationship = classifier.classify(previousSentence, sentence);
        List<String> candidates = catalog.phrases(style, relationship);
        List<String> fresh = candidates.stream().filter(p -> !memory.contains(p)).toList();
        List<String> pool = fresh.isEmpty() ? candidates : fresh;

        String phrase = pool.get(random.nextInt(pool.size()));
        memory.record(phrase);
        log.debug("[Transition] '{}' ({}, {})", phrase, relationship, style);

        return phrase + ", " + SentenceText.lowercaseFirst(sentence, opensWithProperNoun(sentence));
    }

    private boolean opensWithProperNoun(String sentence) {
        if (!annotator.isAvailable()) {
            return false;
        }
        return annotator.annotate(sentence).firstWord()
                .map(t -> t.pos() == PartOfSpeech.PROPN)
                .orElse(false);
    }
}
