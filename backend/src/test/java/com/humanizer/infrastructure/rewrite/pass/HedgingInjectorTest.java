package com.humanizer.infrastructure.rewrite.pass;

import com.humanizer.domain.language.service.LinguisticAnnotator;
import com.humanizer.domain.rewrite.model.SubjectType;
import com.humanizer.infrastructure.rewrite.ScriptedRandom;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.humanizer.infrastructure.rewrite.RewriteComponents.ANNOTATOR;
import static com.humanizer.infrastructure.rewrite.RewriteComponents.MARKERS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HedgingInjectorTest {

    @Mock
    private LinguisticAnnotator unavailableAnnotator;

    private HedgingInjector injector;

    @BeforeEach
    void setUp() {
        injector = new HedgingInjector(ANNOTATOR, MARKERS);
    }

    @Nested
    @DisplayName("Gates")
    class Gates {

        @Test
        @DisplayName("fewer than four words → never hedged")
        void too_short() {
            assertThat(injector.skipsGlobally("It works well.")).isTrue();
            assertThat(injector.hedge("It works well.", 1.0, ScriptedRandom.always(0.0))).isEqualTo("It works well.");
        }

        @Test
        @DisplayName("clock time and unit measurement → never hedged")
        void measurement() {
            String sentence = "The meeting is at 3 PM, which is 15 degrees Celsius";

            assertThat(injector.skipsGlobally(sentence)).isTrue();
            assertThat(injector.hedge(sentence, 1.0, ScriptedRandom.always(0.0))).isEqualTo(sentence);
        }

        @Test
        @DisplayName("questions, placeholders, definitions and technical vocabulary are skipped")
        void other_gates() {
            assertThat(injector.skipsGlobally("Does the study prove the hypothesis?")).isTrue();
            assertThat(injector.skipsGlobally("The result is shown in [[REF_1]] clearly.")).isTrue();
            assertThat(injector.skipsGlobally("A mutex is defined as a lock.")).isTrue();
            assertThat(injector.skipsGlobally("The function returns a boolean value.")).isTrue();
            assertThat(injector.skipsGlobally("The study proves the hypothesis.")).isFalse();
        }

        @Test
        @DisplayName("technical subject making a guarantee → untouched")
        void technical_guarantee() {
            String sentence = "The protocol guarantees delivery of every message.";

            assertThat(injector.classifySubject(ANNOTATOR.annotate(sentence))).isEqualTo(SubjectType.TECHNICAL);
            assertThat(injector.hedge(sentence, 1.0, ScriptedRandom.always(0.0))).isEqualTo(sentence);
        }

        @Test
        @DisplayName("unavailable annotator → untouched")
        void unavailable() {
            when(unavailableAnnotator.isAvailable()).thenReturn(false);
            HedgingInjector withoutAnnotation = new HedgingInjector(unavailableAnnotator, MARKERS);

            assertThat(withoutAnnotation.hedge("The study proves the hypothesis.", 1.0, ScriptedRandom.always(0.0)))
                    .isEqualTo("The study proves the hypothesis.");
        }

        @Test
        @DisplayName("probability 0 → untouched")
        void never() {
            assertThat(injector.hedge("The study proves the hypothesis.", 0.0, ScriptedRandom.always(0.0)))
                    .isEqualTo("The study proves the hypothesis.");
        }
    }

    @Nested
    @DisplayName("Strategies")
    class Strategies {

        @Test
        @DisplayName("modal substitution softens a strong root verb")
        void modal_substitution() {
            assertThat(injector.hedge("The study proves the hypothesis.", 1.0, ScriptedRandom.always(0.0)))
                    .isEqualTo("The study suggests the hypothesis.");
        }

        @Test
        @DisplayName("frequency adverb goes before a present-tense root verb")
        void frequency_adverb() {
            // overall gate, modal skipped, frequency fires
            ScriptedRandom random = new ScriptedRandom(0.99, 0.0, 0.99, 0.0);

            assertThat(injector.hedge("The new method improves accuracy.", 1.0, random))
                    .isEqualTo("The new method often improves accuracy.");
        }

        @Test
        @DisplayName("approximator goes before a strong adjective")
        void approximator() {
            ScriptedRandom random = new ScriptedRandom(0.99, 0.0, 0.99, 0.99, 0.0);

            assertThat(injector.hedge("It was a significant improvement overall.", 1.0, random))
                    .isEqualTo("It was a relatively significant improvement overall.");
        }

        @Test
        @DisplayName("approximator is not placed after \"an\"")
        void approximator_after_an() {
            ScriptedRandom random = new ScriptedRandom(0.99, 0.0, 0.99, 0.99, 0.0);

            assertThat(injector.hedge("It was an important decision for everyone.", 1.0, random))
                    .isEqualTo("It was an important decision for everyone.");
        }

        @Test
        @DisplayName("epistemic adverb follows a copula")
        void epistemic_adverb() {
            ScriptedRandom random = new ScriptedRandom(0.99, 0.0, 0.99, 0.99, 0.99, 0.0);

            assertThat(injector.hedge("The weather was pleasant.", 1.0, random))
                    .isEqualTo("The weather was arguably pleasant.");
        }

        @Test
        @DisplayName("hedges attach to the main clause, not to a \"that\" clause")
        void main_clause_only() {
            String sentence = "The main problem is that users leave the site.";

            // frequency fires but the main verb is a copula
            assertThat(injector.hedge(sentence, 1.0, new ScriptedRandom(0.99, 0.0, 0.99, 0.0)))
                    .isEqualTo(sentence);
            assertThat(injector.hedge(sentence, 1.0, new ScriptedRandom(0.99, 0.0, 0.99, 0.99, 0.99, 0.0)))
                    .isEqualTo("The main problem is arguably that users leave the site.");
        }

        @Test
        @DisplayName("scope limiter prefixes the sentence")
        void scope_limiter() {
            ScriptedRandom random = new ScriptedRandom(0.99, 0.0, 0.99, 0.99, 0.99, 0.99, 0.0);

            assertThat(injector.hedge("The weather was pleasant all week.", 1.0, random))
                    .isEqualTo("In many cases, the weather was pleasant all week.");
        }
    }
}
