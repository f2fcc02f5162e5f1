package com.humanizer.infrastructure.nlp;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Word and sentence counts reported in the humanize result.
 * A word is a run of letters/digits; internal apostrophes and hyphens keep it one word,
 * so "don't" and "well-known" each count once.
 */
@Component
@RequiredArgsConstructor
public class TextStatistics {

    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}]+(?:['’\\-][\\p{L}\\p{N}]+)*");

    private final SentenceSplitter sentenceSplitter;

    public int countWords(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        int count = 0;
        Matcher m = WORD.matcher(text);
        while (m.find()) {
            count++;
        }
        return count;
    }

    public int countSentences(String text) {
        return sentenceSplitter.split(text).size();
    }
}
