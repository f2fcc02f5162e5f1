package com.humanizer.infrastructure.rewrite.pass;

import com.humanizer.infrastructure.rewrite.ScriptedRandom;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.humanizer.infrastructure.rewrite.RewriteComponents.ANNOTATOR;
import static com.humanizer.infrastructure.rewrite.RewriteComponents.MARKERS;
import static org.assertj.core.api.Assertions.assertThat;

class ImperfectionInjectorTest {

    private ImperfectionInjector injector;

    @BeforeEach
    void setUp() {
        injector = new ImperfectionInjector(MARKERS, ANNOTATOR);
    }

    @Test
    @DisplayName("serial comma before the final conjunction is dropped")
    void drop_serial_comma() {
        assertThat(injector.dropSerialComma("We need eggs, milk, and bread."))
                .isEqualTo("We need eggs, milk and bread.");
        assertThat(injector.dropSerialComma("We need eggs and bread."))
                .isEqualTo("We need eggs and bread.");
    }

    @Test
    @DisplayName("one single space between words becomes a double space")
    void double_space() {
        assertThat(injector.doubleSpace("One two three", ScriptedRandom.always(0.0)))
                .isEqualTo("One  two three");
    }

    @Test
    @DisplayName("all three irregularities when every coin lands")
    void all_irregularities() {
        assertThat(injector.inject("We need eggs, milk, and bread.", ScriptedRandom.always(0.0)))
                .isEqualTo("Honestly, we  need eggs, milk and bread.");
    }

    @Test
    @DisplayName("no filler on a sentence that already opens with a marker")
    void no_filler_after_marker() {
        String result = injector.inject("However, we need eggs and bread today.", ScriptedRandom.always(0.0));

        assertThat(result).startsWith("However,");
    }

    @Test
    @DisplayName("failed coin-flips leave the sentence untouched")
    void untouched() {
        assertThat(injector.inject("We need eggs, milk, and bread.", ScriptedRandom.always(0.99)))
                .isEqualTo("We need eggs, milk, and bread.");
    }
}
