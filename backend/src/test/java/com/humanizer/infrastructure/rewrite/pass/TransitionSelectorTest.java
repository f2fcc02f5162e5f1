package com.humanizer.infrastructure.rewrite.pass;

import com.humanizer.infrastructure.rewrite.ScriptedRandom;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static com.humanizer.infrastructure.rewrite.RewriteComponents.TRANSITIONS;
import static org.assertj.core.api.Assertions.assertThat;

class TransitionSelectorTest {

    @Test
    @DisplayName("first sentence of the text never gets a transition")
    void first_sentence() {
        assertThat(TRANSITIONS.addTransition("It runs fast.", null, new TransitionMemory(), 1.0, "balanced",
                ScriptedRandom.always(0.0)))
                .isEqualTo("It runs fast.");
    }

    @Test
    @DisplayName("sentence already opening with a marker is left alone")
    void existing_marker() {
        assertThat(TRANSITIONS.addTransition("However, it is slow.", "The model is accurate.", new TransitionMemory(),
                1.0, "balanced", ScriptedRandom.always(0.0)))
                .isEqualTo("However, it is slow.");
    }

    @Test
    @DisplayName("phrase is prefixed with a comma and the sentence lower-cased")
    void prefixes_phrase() {
        TransitionMemory memory = new TransitionMemory();

        String result = TRANSITIONS.addTransition("It runs on a laptop.", "The model is accurate.", memory,
                1.0, "balanced", ScriptedRandom.always(0.0));

        assertThat(result).isEqualTo("Also, it runs on a laptop.");
        assertThat(memory.contains("Also")).isTrue();
    }

    @Test
    @DisplayName("recently used phrases are avoided")
    void avoids_recent() {
        TransitionMemory memory = new TransitionMemory();
        memory.record("Also");
        memory.record("In addition");
        memory.record("Additionally");

        String result = TRANSITIONS.addTransition("It runs on a laptop.", "The model is accurate.", memory,
                1.0, "balanced", ScriptedRandom.always(0.0));

        assertThat(result).startsWith("Moreover, ");
        assertThat(memory.snapshot()).containsExactly("In addition", "Additionally", "Moreover");
    }

    @Test
    @DisplayName("probability 0 never adds a transition")
    void never() {
        assertThat(TRANSITIONS.addTransition("It runs on a laptop.", "The model is accurate.", new TransitionMemory(),
                0.0, "balanced", new Random(7)))
                .isEqualTo("It runs on a laptop.");
    }
}
