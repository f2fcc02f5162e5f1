package com.humanizer.infrastructure.rewrite.pass;

import com.humanizer.domain.rewrite.model.CombineResult;
import com.humanizer.domain.rewrite.model.SentenceRelationship;
import com.humanizer.infrastructure.rewrite.ScriptedRandom;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.humanizer.infrastructure.rewrite.RewriteComponents.COMBINER;
import static org.assertj.core.api.Assertions.assertThat;

class SentenceCombinerTest {

    @Nested
    @DisplayName("combine")
    class Combine {

        @Test
        @DisplayName("short sentence + anaphoric follow-up → joined with \"and\"")
        void joins_with_and() {
            CombineResult result = COMBINER.combine("Yes.", "It works.", ScriptedRandom.always(0.0));

            assertThat(result.success()).isTrue();
            assertThat(result.merged()).isEqualTo("Yes and it works.");
            assertThat(result.relationship()).isEqualTo(SentenceRelationship.ADDITION);
        }

        @Test
        @DisplayName("topic shift is never merged")
        void refuses_topic_shift() {
            CombineResult result = COMBINER.combine("I like cats.", "Meanwhile, stocks fell.", ScriptedRandom.always(0.0));

            assertThat(result.success()).isFalse();
            assertThat(result.relationship()).isEqualTo(SentenceRelationship.UNSAFE);
        }

        @Test
        @DisplayName("contrast drops the redundant marker and uses a contrast connector")
        void contrast_connector() {
            CombineResult result = COMBINER.combine("The model is accurate.", "However, it is slow.",
                    ScriptedRandom.always(0.0));

            assertThat(result.merged()).isEqualTo("The model is accurate but it is slow.");
        }

        @Test
        @DisplayName("first sentence of six or more words is not merged")
        void first_too_long() {
            CombineResult result = COMBINER.combine("The model is very accurate today.", "It is slow.",
                    ScriptedRandom.always(0.0));

            assertThat(result.success()).isFalse();
        }

        @Test
        @DisplayName("merged sentence may not exceed twenty words")
        void combined_too_long() {
            String longNext = "It runs on every machine in the lab and in the office and at home on weekends too.";
            CombineResult result = COMBINER.combine("It works well.", longNext, ScriptedRandom.always(0.0));

            assertThat(result.success()).isFalse();
        }

        @Test
        @DisplayName("the connector is counted against the twenty-word limit")
        void connector_counts() {
            String eighteen = "It runs on every machine in the lab and in the office and at home daily every weekend.";
            String seventeen = "It runs on every machine in the lab and in the office and at home every weekend.";

            CombineResult over = COMBINER.combine("It works.", eighteen, ScriptedRandom.always(0.0));
            CombineResult atLimit = COMBINER.combine("It works.", seventeen, ScriptedRandom.always(0.0));

            assertThat(over.success()).isFalse();
            assertThat(atLimit.success()).isTrue();
            assertThat(atLimit.merged())
                    .isEqualTo("It works and it runs on every machine in the lab and in the office and at home every weekend.");
            assertThat(SentenceText.wordCount(atLimit.merged())).isEqualTo(20);
        }

        @Test
        @DisplayName("questions and exclamations are not continued")
        void question_not_merged() {
            assertThat(COMBINER.combine("Is it done?", "It works.", ScriptedRandom.always(0.0)).success()).isFalse();
            assertThat(COMBINER.combine("Great!", "It works.", ScriptedRandom.always(0.0)).success()).isFalse();
        }
    }

    @Nested
    @DisplayName("varyLength")
    class VaryLength {

        @Test
        @DisplayName("a merge consumes both sentences; unsafe pairs stay apart")
        void single_pass() {
            List<String> result = COMBINER.varyLength(
                    List.of("Yes.", "It works.", "Meanwhile, stocks fell."), 1.0, ScriptedRandom.always(0.0));

            assertThat(result).containsExactly("Yes and it works.", "Meanwhile, stocks fell.");
        }

        @Test
        @DisplayName("probability 0 leaves the list as is")
        void never() {
            List<String> input = List.of("Yes.", "It works.");

            assertThat(COMBINER.varyLength(input, 0.0, ScriptedRandom.always(0.0))).containsExactlyElementsOf(input);
        }

        @Test
        @DisplayName("\"I like cats. Meanwhile, stocks fell.\" stays two sentences")
        void topic_shift_kept_apart() {
            assertThat(COMBINER.varyLength(List.of("I like cats.", "Meanwhile, stocks fell."), 1.0,
                    ScriptedRandom.always(0.0)))
                    .containsExactly("I like cats.", "Meanwhile, stocks fell.");
        }
    }
}
