package com.humanizer.infrastructure.rewrite.pipeline;

import com.humanizer.domain.rewrite.model.HumanizeResult;
import com.humanizer.domain.rewrite.model.RewriteOverrides;
import com.humanizer.infrastructure.rewrite.RewriteComponents;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Random;

import static com.humanizer.infrastructure.rewrite.RewriteComponents.REGISTRY;
import static org.assertj.core.api.Assertions.assertThat;

class RewritePipelineTest {

    private static final RewriteOverrides STILL = new RewriteOverrides(
            0.0, 0.0, 0.0, 0.0, null, null, null, null, false, 0.0, 0.0);

    private final RewritePipeline pipeline = RewriteComponents.pipeline();

    private HumanizeResult run(String text, String style, RewriteOverrides overrides, long seed) {
        return pipeline.execute(text, REGISTRY.resolve(style, overrides), new Random(seed));
    }

    @Nested
    @DisplayName("Citations")
    class Citations {

        private static final String TEXT = "Prior work shows a strong effect (Smith, 2020). "
                + "The effect was replicated in a larger sample (Jones et al., 2019, pp. 4-7). "
                + "However, the sample was small (Lee, 2021).";

        @ParameterizedTest
        @ValueSource(strings = {"academic", "formal", "casual", "technical", "creative", "balanced"})
        @DisplayName("every citation survives verbatim in every style")
        void citationsSurvive(String style) {
            for (long seed = 1; seed <= 5; seed++) {
                String humanized = run(TEXT, style, null, seed).humanizedText();

                assertThat(humanized)
                        .contains("(Smith, 2020)")
                        .contains("(Jones et al., 2019, pp. 4-7)")
                        .contains("(Lee, 2021)")
                        .doesNotContain("[[");
            }
        }

        @Test
        @DisplayName("technical text keeps its citation and domain term")
        void technicalTerms() {
            String humanized = run("The algorithm is fast (Smith, 2020). It always works.", "technical", null, 3)
                    .humanizedText();

            assertThat(humanized).contains("(Smith, 2020)").contains("algorithm");
        }
    }

    @Test
    @DisplayName("same seed, same output")
    void deterministicWithSeed() {
        String text = "The team reviewed the results in the morning. The results were good. "
                + "The method is not perfect. It does not handle noise.";

        HumanizeResult first = run(text, "creative", null, 42);
        HumanizeResult second = run(text, "creative", null, 42);

        assertThat(second.humanizedText()).isEqualTo(first.humanizedText());
    }

    @Test
    @DisplayName("forced combination merges two short sentences")
    void forcedCombination() {
        RewriteOverrides combineOnly = new RewriteOverrides(
                0.0, 0.0, 0.0, 1.0, null, null, null, null, null, 0.0, 0.0);

        HumanizeResult result = run("Yes. It works.", "balanced", combineOnly, 1);

        assertThat(result.humanizedText()).isEqualTo("Yes and it works.");
        assertThat(result.originalSentenceCount()).isEqualTo(2);
        assertThat(result.humanizedSentenceCount()).isEqualTo(1);
        assertThat(result.originalWordCount()).isEqualTo(3);
        assertThat(result.humanizedWordCount()).isEqualTo(3);
        assertThat(result.styleUsed()).isEqualTo("balanced");
    }

    @Test
    @DisplayName("paragraph breaks are preserved")
    void paragraphsPreserved() {
        String text = "The first paragraph has one sentence.\n\nThe second paragraph has another one.";

        assertThat(run(text, "balanced", STILL, 1).humanizedText()).isEqualTo(text);
        assertThat(run(text, "casual", null, 9).humanizedText()).contains("\n\n");
    }

    // ── Edge cases ──

    @Test
    @DisplayName("empty and blank input produce an empty result")
    void emptyInput() {
        for (String text : new String[]{"", "   ", null}) {
            HumanizeResult result = run(text, "balanced", null, 1);

            assertThat(result.humanizedText()).isEmpty();
            assertThat(result.originalWordCount()).isZero();
            assertThat(result.humanizedWordCount()).isZero();
            assertThat(result.originalSentenceCount()).isZero();
            assertThat(result.humanizedSentenceCount()).isZero();
        }
    }

    @Test
    @DisplayName("with every probability at zero the text is returned as is")
    void allZero() {
        String text = "The model is accurate. It runs on a laptop.";

        assertThat(run(text, "balanced", STILL, 5).humanizedText()).isEqualTo(text);
    }
}
