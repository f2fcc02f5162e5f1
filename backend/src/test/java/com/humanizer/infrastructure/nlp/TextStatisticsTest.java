package com.humanizer.infrastructure.nlp;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextStatisticsTest {

    private TextStatistics statistics;

    @BeforeEach
    void setUp() {
        statistics = new TextStatistics(new SentenceSplitter());
    }

    @Test
    @DisplayName("contractions and hyphenated words count once")
    void word_count() {
        assertThat(statistics.countWords("Don't stop the well-known test.")).isEqualTo(5);
    }

    @Test
    @DisplayName("punctuation alone is not a word")
    void punctuation_only() {
        assertThat(statistics.countWords("... !? --")).isZero();
    }

    @Test
    @DisplayName("empty text has no words and no sentences")
    void empty_text() {
        assertThat(statistics.countWords("")).isZero();
        assertThat(statistics.countSentences("")).isZero();
    }

    @Test
    @DisplayName("sentences are counted with the splitter")
    void sentence_count() {
        assertThat(statistics.countSentences("One. Two! Three?")).isEqualTo(3);
    }
}
