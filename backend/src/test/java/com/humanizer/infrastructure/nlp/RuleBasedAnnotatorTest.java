package com.humanizer.infrastructure.nlp;

import com.humanizer.domain.language.exception.AnnotationUnavailableException;
import com.humanizer.domain.language.model.Annotation;
import com.humanizer.domain.language.model.DependencyRole;
import com.humanizer.domain.language.model.EntitySpan;
import com.humanizer.domain.language.model.PartOfSpeech;
import com.humanizer.domain.language.model.Token;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleBasedAnnotatorTest {

    private static RuleBasedAnnotator annotator;

    @BeforeAll
    static void setUp() {
        EnglishLexicon lexicon = new EnglishLexicon(EnglishLexicon.DEFAULT_PATH);
        annotator = new RuleBasedAnnotator(lexicon, new Lemmatizer(lexicon));
    }

    private static Token token(Annotation annotation, String text) {
        return annotation.tokens().stream()
                .filter(t -> t.text().equals(text))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no token " + text));
    }

    @Nested
    @DisplayName("Tagging")
    class Tagging {

        @Test
        @DisplayName("subject, verb and object of a simple clause")
        void simple_clause() {
            Annotation annotation = annotator.annotate("The researchers analyzed the data.");

            assertThat(token(annotation, "researchers").pos()).isEqualTo(PartOfSpeech.NOUN);
            assertThat(token(annotation, "researchers").depRole()).isEqualTo(DependencyRole.NSUBJ);
            assertThat(token(annotation, "researchers").lemma()).isEqualTo("researcher");
            assertThat(token(annotation, "analyzed").pos()).isEqualTo(PartOfSpeech.VERB);
            assertThat(token(annotation, "analyzed").depRole()).isEqualTo(DependencyRole.ROOT);
            assertThat(token(annotation, "analyzed").lemma()).isEqualTo("analyze");
            assertThat(token(annotation, "data").depRole()).isEqualTo(DependencyRole.DOBJ);
            assertThat(token(annotation, ".").pos()).isEqualTo(PartOfSpeech.PUNCT);
        }

        @Test
        @DisplayName("\"like\" after a pronoun is a verb")
        void like_as_verb() {
            Annotation annotation = annotator.annotate("I like cats.");

            assertThat(token(annotation, "like").pos()).isEqualTo(PartOfSpeech.VERB);
            assertThat(annotation.subject()).map(Token::text).contains("I");
        }

        @Test
        @DisplayName("\"like\" after the main verb is a preposition")
        void like_as_preposition() {
            Annotation annotation = annotator.annotate("It works like a charm.");

            assertThat(token(annotation, "works").pos()).isEqualTo(PartOfSpeech.VERB);
            assertThat(token(annotation, "like").pos()).isEqualTo(PartOfSpeech.ADP);
        }

        @Test
        @DisplayName("citation placeholders are single opaque tokens")
        void placeholder_token() {
            Annotation annotation = annotator.annotate("It works [[REF_1]].");

            assertThat(token(annotation, "[[REF_1]]").pos()).isEqualTo(PartOfSpeech.X);
            assertThat(annotation.wordCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("a copula before \"that\" is the root, the embedded verb is its complement")
        void copula_with_clause() {
            Annotation annotation = annotator.annotate("The main problem is that users leave the site.");

            assertThat(token(annotation, "that").pos()).isEqualTo(PartOfSpeech.SCONJ);
            assertThat(annotation.root()).map(Token::text).contains("is");
            assertThat(token(annotation, "leave").depRole()).isEqualTo(DependencyRole.CCOMP);
            assertThat(annotation.subject()).map(Token::text).contains("problem");
        }

        @Test
        @DisplayName("negated auxiliaries keep their auxiliary lemma")
        void negated_auxiliary() {
            Annotation annotation = annotator.annotate("It doesn't work.");

            assertThat(token(annotation, "doesn't").pos()).isEqualTo(PartOfSpeech.AUX);
            assertThat(token(annotation, "doesn't").lemma()).isEqualTo("do");
        }
    }

    @Nested
    @DisplayName("Entities")
    class Entities {

        @Test
        @DisplayName("runs of proper nouns form one entity")
        void proper_noun_runs() {
            Annotation annotation = annotator.annotate("Marie Curie visited Paris.");

            assertThat(annotation.entities()).extracting(EntitySpan::text)
                    .containsExactly("Marie Curie", "Paris");
        }
    }

    @Nested
    @DisplayName("Availability")
    class Availability {

        @Test
        @DisplayName("bundled lexicon makes the annotator available")
        void available() {
            assertThat(annotator.isAvailable()).isTrue();
        }

        @Test
        @DisplayName("missing lexicon → unavailable and annotate throws")
        void unavailable() {
            EnglishLexicon missing = new EnglishLexicon("lexicon/does-not-exist.json");
            RuleBasedAnnotator unloaded = new RuleBasedAnnotator(missing, new Lemmatizer(missing));

            assertThat(unloaded.isAvailable()).isFalse();
            assertThatThrownBy(() -> unloaded.annotate("It works."))
                    .isInstanceOf(AnnotationUnavailableException.class);
        }

        @Test
        @DisplayName("blank sentence → empty annotation")
        void blank_sentence() {
            Annotation annotation = annotator.annotate("   ");

            assertThat(annotation.tokens()).isEmpty();
            assertThat(annotation.entities()).isEmpty();
        }
    }
}
