package com.humanizer.infrastructure.rewrite.pass;

import com.humanizer.domain.language.model.PartOfSpeech;
import com.humanizer.domain.language.service.LinguisticAnnotator;
import com.humanizer.domain.rewrite.model.CombineResult;
import com.humanizer.domain.rewrite.model.SentenceRelationship;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Merges a short sentence with its successor using a connector that fits their relationship:
 * "Yes. It works." → "Yes and it works."
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SentenceCombiner {

    /** The first sentence must have fewer words than this. */
    static final int MAX_FIRST_WORDS = 6;

    /** The merged sentence may have at most this many words. */
    static final int MAX_COMBINED_WORDS = 20;

    private static final List<String> CONTRAST_CONNECTORS = List.of("but", "yet");
    private static final List<String> CAUSE_CONNECTORS = List.of("so", "and so");

    private final SentenceRelationshipClassifier classifier;
    private final DiscourseMarkers markers;
    private final LinguisticAnnotator annotator;

    /**
     * Try to merge two adjacent sentences.
     *
     * @return the merged sentence, or a refusal carrying the relationship that blocked it
     */
    public CombineResult combine(String previous, String next, Random random) {
        int firstWords = SentenceText.wordCount(previous);
        if (firstWords == 0 || firstWords >= MAX_FIRST_WORDS) {
            return CombineResult.refused(SentenceRelationship.NONE);
        }
        // a question or exclamation cannot be continued with a connector
        String terminal = SentenceText.terminalPunctuation(previous);
        if (terminal.contains("?") || terminal.contains("!")) {
            return CombineResult.refused(SentenceRelationship.NONE);
        }

        SentenceRelationship relationship = classifier.classify(previous, next);
        if (!relationship.isSafe()) {
            log.debug("[Combiner] Refused ({}): '{}' + '{}'", relationship, previous, next);
            return CombineResult.refused(relationship);
        }

        String connector = connector(relationship, random);
        String second = dropRedundantMarker(next, relationship);
        second = SentenceText.lowercaseFirst(second, opensWithProperNoun(second));
        String merged = SentenceText.stripTerminalPunctuation(previous) + " " + connector + " " + second;
        // the connector counts too
        if (SentenceText.wordCount(merged) > MAX_COMBINED_WORDS) {
            log.debug("[Combiner] Refused (too long): '{}' + '{}'", previous, next);
            return CombineResult.refused(SentenceRelationship.NONE);
        }
        return new CombineResult(merged, relationship);
    }

    /**
     * Single left-to-right pass. Each position whose sentence is short enough and has a successor gets one
     * coin-flip; a merge consumes both sentences.
     */
    public List<String> varyLength(List<String> sentences, double probability, Random random) {
        List<String> result = new ArrayList<>(sentences.size());
        int i = 0;
        while (i < sentences.size()) {
            String current = sentences.get(i);
            boolean eligible = i + 1 < sentences.size() && SentenceText.wordCount(current) < MAX_FIRST_WORDS;
            if (eligible && random.nextDouble() < probability) {
                CombineResult combined = combine(current, sentences.get(i + 1), random);
                if (combined.success()) {
                    result.add(combined.merged());
                    i += 2;
                    continue;
                }
            }
            result.add(current);
            i++;
        }
        return result;
    }

    private static String connector(SentenceRelationship relationship, Random random) {
        return switch (relationship) {
            case CONTRAST -> CONTRAST_CONNECTORS.get(random.nextInt(CONTRAST_CONNECTORS.size()));
            case CAUSE -> CAUSE_CONNECTORS.get(random.nextInt(CAUSE_CONNECTORS.size()));
            default -> "and";
        };
    }

    // "However, it failed." joined with "but" → "it failed."
    private String dropRedundantMarker(String sentence, SentenceRelationship relationship) {
        Optional<String> marker = markers.openingMarker(sentence);
        if (marker.isEmpty()) {
            return sentence;
        }
        boolean redundant = (relationship == SentenceRelationship.CONTRAST && markers.isContrastMarker(marker.get()))
                || (relationship == SentenceRelationship.CAUSE && markers.isCauseMarker(marker.get()));
        if (!redundant) {
            return sentence;
        }
        String rest = sentence.stripLeading().substring(marker.get().length()).replaceFirst("^\\s*,?\\s*", "");
        return rest.isEmpty() ? sentence : rest;
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
