package com.humanizer.infrastructure.rewrite.pass;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Word lists for discourse markers: sentence openers, contrast and cause signals, topic shifts.
 * All matching is whole-word and case-insensitive.
 */
@Component
public class DiscourseMarkers {

    private static final List<String> COMMON_OPENERS = List.of(
            "however", "moreover", "furthermore", "additionally", "also", "besides", "therefore", "thus",
            "hence", "consequently", "meanwhile", "nevertheless", "nonetheless", "still", "yet", "but", "and",
            "so", "or", "then", "first", "firstly", "second", "secondly", "third", "thirdly", "finally", "lastly",
            "in addition", "on the other hand", "for example", "for instance", "in fact", "as a result",
            "similarly", "likewise", "instead", "indeed", "overall", "in short", "in conclusion", "in summary",
            "to summarize", "of course", "after all", "after that", "well", "anyway", "plus", "actually",
            "basically", "honestly", "in other words", "that said", "even so", "by contrast", "in contrast",
            "alternatively", "accordingly", "conversely", "specifically", "notably", "importantly",
            "in general", "in many cases", "in most contexts", "for the most part", "to some extent",
            "under typical conditions"
    );

    private static final List<String> CONTRAST_MARKERS = List.of(
            "however", "but", "although", "though", "despite", "yet", "nevertheless", "nonetheless", "unlike",
            "whereas", "in contrast", "by contrast", "on the other hand", "conversely", "instead", "even so"
    );

    private static final List<String> CAUSE_MARKERS = List.of(
            "because", "since", "therefore", "thus", "so", "consequently", "as a result", "hence",
            "accordingly", "due to", "for this reason", "that is why", "that's why"
    );

    private static final List<String> OPENING_TOPIC_SHIFTS = List.of(
            "meanwhile", "first", "firstly", "second", "secondly", "third", "thirdly", "fourth", "fifth",
            "next", "finally", "lastly", "in other news", "on another note", "on a different note",
            "turning to", "separately"
    );

    private static final Pattern STEP_N = Pattern.compile("(?<![\\p{L}\\p{N}])step\\s+\\d+(?![\\p{N}])",
            Pattern.CASE_INSENSITIVE);

    // "Interestingly," "Sadly,": a single -ly adverb followed by a comma
    private static final Pattern LY_OPENER = Pattern.compile("^[\"'“‘(]*[A-Za-z]+ly\\s*,");

    private final List<String> openers;

    public DiscourseMarkers(TransitionCatalog catalog) {
        List<String> all = new ArrayList<>(COMMON_OPENERS);
        for (String phrase : catalog.allPhrases()) {
            String lower = phrase.toLowerCase(Locale.ROOT);
            if (!all.contains(lower)) {
                all.add(lower);
            }
        }
        // longest first so "on the other hand" is found before "on"
        all.sort(Comparator.comparingInt(String::length).reversed());
        this.openers = List.copyOf(all);
    }

    public boolean opensWithMarker(String sentence) {
        return openingMarker(sentence).isPresent() || LY_OPENER.matcher(sentence.stripLeading()).find();
    }

    /**
     * The discourse marker the sentence opens with, in lower case.
     */
    public Optional<String> openingMarker(String sentence) {
        if (sentence == null || sentence.isBlank()) {
            return Optional.empty();
        }
        for (String marker : openers) {
            if (SentenceText.opensWith(sentence, marker)) {
                return Optional.of(marker);
            }
        }
        return Optional.empty();
    }

    public boolean isTopicShift(String sentence) {
        if (sentence == null) {
            return false;
        }
        for (String marker : OPENING_TOPIC_SHIFTS) {
            if (SentenceText.opensWith(sentence, marker)) {
                return true;
            }
        }
        return STEP_N.matcher(sentence).find();
    }

    public boolean hasContrastMarker(String sentence) {
        return containsAny(sentence, CONTRAST_MARKERS);
    }

    public boolean hasCauseMarker(String sentence) {
        return containsAny(sentence, CAUSE_MARKERS);
    }

    public boolean isContrastMarker(String marker) {
        return CONTRAST_MARKERS.contains(marker);
    }

    public boolean isCauseMarker(String marker) {
        return CAUSE_MARKERS.contains(marker);
    }

    private static boolean containsAny(String sentence, List<String> markers) {
        if (sentence == null) {
            return false;
        }
        for (String marker : markers) {
            if (SentenceText.containsPhrase(sentence, marker)) {
                return true;
            }
        }
        return false;
    }
}
