package com.humanizer.infrastructure.rewrite.preprocessing;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    private TextNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new TextNormalizer();
    }

    @Test
    @DisplayName("whitespace before punctuation is removed")
    void space_before_punctuation() {
        assertThat(normalizer.normalizePunctuation("It works , mostly .")).isEqualTo("It works, mostly.");
    }

    @Test
    @DisplayName("whitespace inside parentheses is removed")
    void space_inside_parentheses() {
        assertThat(normalizer.normalizePunctuation("A value ( roughly ten ) here.")).isEqualTo("A value (roughly ten) here.");
    }

    @Test
    @DisplayName("doubled spaces between words survive")
    void doubled_space_kept() {
        assertThat(normalizer.normalizePunctuation("It  works.")).isEqualTo("It  works.");
    }

    @Test
    @DisplayName("paragraph breaks survive")
    void newlines_kept() {
        assertThat(normalizer.normalizePunctuation("One.\n\nTwo .")).isEqualTo("One.\n\nTwo.");
    }

    @Test
    @DisplayName("protected spans come out byte-identical")
    void protected_span_untouched() {
        String citation = "( Smith , 2020 )";
        String text = "Shown here " + citation + " , clearly .";

        String result = normalizer.normalizePunctuation(text, List.of(citation));
        assertThat(result).isEqualTo("Shown here " + citation + ", clearly.");
    }

    @Test
    @DisplayName("null and empty input pass through")
    void empty_input() {
        assertThat(normalizer.normalizePunctuation(null)).isNull();
        assertThat(normalizer.normalizePunctuation("")).isEmpty();
    }
}
