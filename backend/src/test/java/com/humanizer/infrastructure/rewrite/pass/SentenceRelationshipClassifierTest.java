package com.humanizer.infrastructure.rewrite.pass;

import com.humanizer.domain.language.service.LinguisticAnnotator;
import com.humanizer.domain.rewrite.model.SentenceRelationship;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.humanizer.infrastructure.rewrite.RewriteComponents.CLASSIFIER;
import static com.humanizer.infrastructure.rewrite.RewriteComponents.MARKERS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SentenceRelationshipClassifierTest {

    @Mock
    private LinguisticAnnotator unavailableAnnotator;

    @Nested
    @DisplayName("With annotation")
    class WithAnnotation {

        @Test
        @DisplayName("topic-shift opener → UNSAFE")
        void topic_shift() {
            assertThat(CLASSIFIER.classify("I like cats.", "Meanwhile, stocks fell."))
                    .isEqualTo(SentenceRelationship.UNSAFE);
        }

        @Test
        @DisplayName("unrelated subjects from different domains → UNSAFE")
        void unrelated_subjects() {
            assertThat(CLASSIFIER.classify("The researchers analyzed the data.", "The server crashed."))
                    .isEqualTo(SentenceRelationship.UNSAFE);
        }

        @Test
        @DisplayName("contrast marker with a pronoun subject → CONTRAST")
        void contrast() {
            assertThat(CLASSIFIER.classify("The model is accurate.", "However, it is slow."))
                    .isEqualTo(SentenceRelationship.CONTRAST);
        }

        @Test
        @DisplayName("cause marker → CAUSE")
        void cause() {
            assertThat(CLASSIFIER.classify("The tests failed.", "Therefore, they restarted the server."))
                    .isEqualTo(SentenceRelationship.CAUSE);
        }

        @Test
        @DisplayName("anaphoric opener → ADDITION")
        void anaphoric_opener() {
            assertThat(CLASSIFIER.classify("Yes.", "It works."))
                    .isEqualTo(SentenceRelationship.ADDITION);
        }

        @Test
        @DisplayName("shared entity → ADDITION")
        void shared_entity() {
            assertThat(CLASSIFIER.classify("Alice wrote the report.", "Alice also reviewed the code."))
                    .isEqualTo(SentenceRelationship.ADDITION);
        }

        @Test
        @DisplayName("related subjects but nothing shared → NONE")
        void none() {
            assertThat(CLASSIFIER.classify("The study used a survey.", "The results were clear."))
                    .isEqualTo(SentenceRelationship.NONE);
        }
    }

    @Nested
    @DisplayName("Without annotation")
    class WithoutAnnotation {

        @Test
        @DisplayName("topic shift is still detected without touching the annotator")
        void topic_shift_first() {
            SentenceRelationshipClassifier classifier = new SentenceRelationshipClassifier(unavailableAnnotator, MARKERS);

            assertThat(classifier.classify("I like cats.", "Meanwhile, stocks fell."))
                    .isEqualTo(SentenceRelationship.UNSAFE);
            verifyNoInteractions(unavailableAnnotator);
        }

        @Test
        @DisplayName("everything else defaults to ADDITION")
        void defaults_to_addition() {
            when(unavailableAnnotator.isAvailable()).thenReturn(false);
            SentenceRelationshipClassifier classifier = new SentenceRelationshipClassifier(unavailableAnnotator, MARKERS);

            assertThat(classifier.classify("The cat slept.", "The market crashed."))
                    .isEqualTo(SentenceRelationship.ADDITION);
        }
    }
}
