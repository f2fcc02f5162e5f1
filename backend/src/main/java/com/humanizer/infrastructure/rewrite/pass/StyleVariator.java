package com.humanizer.infrastructure.rewrite.pass;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Breaks runs of sentences that open with the same word by reordering the repeating sentence.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StyleVariator {

    private final ClauseReorderer reorderer;

    public List<String> vary(List<String> sentences, double probability, Random random) {
        if (sentences.size() < 2 || probability <= 0) {
            return sentences;
        }
        List<String> result = new ArrayList<>(sentences.size());
        result.add(sentences.get(0));
        for (int i = 1; i < sentences.size(); i++) {
            String current = sentences.get(i);
            String opener = SentenceText.firstWord(current);
            boolean repeats = !opener.isEmpty() && opener.equals(SentenceText.firstWord(result.get(i - 1)));
            if (repeats && random.nextDouble() < probability) {
                Optional<String> varied = reorderer.reorder(current);
                if (varied.isPresent()) {
                    log.debug("[StyleVariation] Varied opening of sentence {}", i);
                    current = varied.get();
                }
            }
            result.add(current);
        }
        return result;
    }
}
