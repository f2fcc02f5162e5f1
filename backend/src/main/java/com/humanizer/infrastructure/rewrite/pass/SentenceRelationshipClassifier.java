package com.humanizer.infrastructure.rewrite.pass;

import com.humanizer.domain.language.model.Annotation;
import com.humanizer.domain.language.model.EntitySpan;
import com.humanizer.domain.language.model.PartOfSpeech;
import com.humanizer.domain.language.model.Token;
import com.humanizer.domain.language.service.LinguisticAnnotator;
import com.humanizer.domain.rewrite.model.SentenceRelationship;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides how a sentence relates to the one before it. First matching rule wins:
 *   1. topic-shift opener or "step N"                → UNSAFE
 *   2. both subjects present and unrelated           → UNSAFE
 *   3. contrast marker                               → CONTRAST
 *   4. cause marker                                  → CAUSE
 *   5. opens with it / this / these / they / that    → ADDITION
 *   6. shared entity or shared non-trivial noun      → ADDITION
 *   7. otherwise                                     → NONE
 * Without annotation, anything that is not a topic shift is ADDITION.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SentenceRelationshipClassifier {

    private static final Set<String> ANAPHORIC_OPENERS = Set.of("it", "this", "these", "they", "that");

    private static final Set<String> REFERRING_PRONOUNS = Set.of(
            "it", "this", "that", "these", "those", "they", "them", "he", "she", "him", "her", "we", "us",
            "i", "you", "its", "their", "which", "who", "one", "such"
    );

    private static final List<Set<String>> DOMAIN_CLUSTERS = List.of(
            // research
            Set.of("study", "research", "finding", "result", "data", "evidence", "experiment", "analysis",
                    "paper", "survey", "sample", "participant", "author", "researcher", "hypothesis", "trial",
                    "observation", "outcome", "method", "literature"),
            // technical
            Set.of("system", "api", "algorithm", "protocol", "database", "server", "library", "framework",
                    "function", "method", "compiler", "code", "software", "program", "application", "module",
                    "service", "interface", "query", "implementation", "platform", "tool"),
            // AI / machine learning
            Set.of("model", "network", "training", "dataset", "ai", "feature", "prediction", "classifier",
                    "embedding", "inference", "parameter", "accuracy", "transformer", "llm", "agent", "weight",
                    "learning")
    );

    private static final Set<String> TRIVIAL_NOUNS = Set.of(
            "thing", "things", "way", "time", "lot", "kind", "sort", "part", "case", "fact", "point", "something"
    );

    private final LinguisticAnnotator annotator;
    private final DiscourseMarkers markers;

    public SentenceRelationship classify(String previous, String next) {
        if (markers.isTopicShift(next)) {
            return SentenceRelationship.UNSAFE;
        }
        if (!annotator.isAvailable()) {
            return SentenceRelationship.ADDITION;
        }

        Annotation first = annotator.annotate(previous);
        Annotation second = annotator.annotate(next);

        if (subjectsUnrelated(first, second)) {
            return SentenceRelationship.UNSAFE;
        }
        if (markers.hasContrastMarker(next)) {
            return SentenceRelationship.CONTRAST;
        }
        if (markers.hasCauseMarker(next)) {
            return SentenceRelationship.CAUSE;
        }
        if (ANAPHORIC_OPENERS.contains(SentenceText.firstWord(next))) {
            return SentenceRelationship.ADDITION;
        }
        if (sharesEntity(first, second) || sharesNoun(first, second)) {
            return SentenceRelationship.ADDITION;
        }
        return SentenceRelationship.NONE;
    }

    private boolean subjectsUnrelated(Annotation first, Annotation second) {
        Optional<Token> s1 = first.subject();
        Optional<Token> s2 = second.subject();
        if (s1.isEmpty() || s2.isEmpty()) {
            return false;
        }
        String l1 = s1.get().lemma();
        String l2 = s2.get().lemma();
        if (l1.equals(l2)) {
            return false;
        }
        if (s2.get().pos() == PartOfSpeech.PRON || REFERRING_PRONOUNS.contains(l2)) {
            return false;
        }
        for (Set<String> cluster : DOMAIN_CLUSTERS) {
            if (cluster.contains(l1) && cluster.contains(l2)) {
                return false;
            }
        }
        log.debug("[Relationship] Unrelated subjects '{}' / '{}'", l1, l2);
        return true;
    }

    private static boolean sharesEntity(Annotation first, Annotation second) {
        Set<String> names = first.entities().stream()
                .map(e -> e.text().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        for (EntitySpan entity : second.entities()) {
            if (names.contains(entity.text().toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private static boolean sharesNoun(Annotation first, Annotation second) {
        Set<String> nouns = significantNouns(first);
        for (String noun : significantNouns(second)) {
            if (nouns.contains(noun)) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> significantNouns(Annotation annotation) {
        return annotation.tokens().stream()
                .filter(t -> t.pos() == PartOfSpeech.NOUN || t.pos() == PartOfSpeech.PROPN)
                .map(Token::lemma)
                .filter(l -> l.length() > 2 && !TRIVIAL_NOUNS.contains(l))
                .collect(Collectors.toSet());
    }
}
