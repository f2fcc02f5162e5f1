package com.humanizer.infrastructure.rewrite.pass;

import com.humanizer.domain.language.model.PartOfSpeech;
import com.humanizer.domain.language.service.LinguisticAnnotator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Small surface irregularities a person might leave in: a doubled space, a dropped serial comma,
 * a conversational filler at the start.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ImperfectionInjector {

    static final double DOUBLE_SPACE_PROBABILITY = 0.05;
    static final int DOUBLE_SPACE_MIN_WORDS = 6;

    static final double SERIAL_COMMA_PROBABILITY = 0.30;

    static final double FILLER_PROBABILITY = 0.05;
    static final int FILLER_MIN_WORDS = 5;

    private static final List<String> FILLERS = List.of("Honestly,", "Basically,", "Actually,", "Frankly,", "Really,");

    // "A, B, and C": the comma right before the conjunction
    private static final Pattern SERIAL_COMMA = Pattern.compile(",[^,;.!?]+(,)\\s+(?:and|or)\\s");

    private final DiscourseMarkers markers;
    private final LinguisticAnnotator annotator;

    public String inject(String sentence, Random random) {
        if (sentence == null || sentence.isBlank()) {
            return sentence;
        }
        String result = sentence;
        int words = SentenceText.wordCount(result);

        if (words >= DOUBLE_SPACE_MIN_WORDS && random.nextDouble() < DOUBLE_SPACE_PROBABILITY) {
            result = doubleSpace(result, random);
        }
        if (SERIAL_COMMA.matcher(result).find() && random.nextDouble() < SERIAL_COMMA_PROBABILITY) {
            result = dropSerialComma(result);
        }
        if (words >= FILLER_MIN_WORDS && !markers.opensWithMarker(result) && !SentenceText.startsWithPlaceholder(result)
                && random.nextDouble() < FILLER_PROBABILITY) {
            String filler = FILLERS.get(random.nextInt(FILLERS.size()));
            result = filler + " " + SentenceText.lowercaseFirst(result, opensWithProperNoun(result));
            log.debug("[Imperfection] Filler '{}'", filler);
        }
        return result;
    }

    // single spaces between two non-space characters, outside placeholders
    String doubleSpace(String sentence, Random random) {
        List<Integer> gaps = new ArrayList<>();
        for (int i = 1; i < sentence.length() - 1; i++) {
            if (sentence.charAt(i) == ' ' && !Character.isWhitespace(sentence.charAt(i - 1))
                    && !Character.isWhitespace(sentence.charAt(i + 1))
                    && sentence.charAt(i - 1) != '[' && sentence.charAt(i + 1) != ']') {
                gaps.add(i);
            }
        }
        if (gaps.isEmpty()) {
            return sentence;
        }
        int at = gaps.get(random.nextInt(gaps.size()));
        return sentence.substring(0, at) + " " + sentence.substring(at);
    }

    String dropSerialComma(String sentence) {
        Matcher m = SERIAL_COMMA.matcher(sentence);
        if (!m.find()) {
            return sentence;
        }
        return sentence.substring(0, m.start(1)) + sentence.substring(m.end(1));
    }

    private boolean opensWithProperNoun(String sentence) {
        if (!annotator.isAvailable()) {
            return false;
        }
        return annotator.annotate(sentence).firstWord()
                .map(t -> t.pos() == PartOfSpeech.PROPN)
                .orElse(false);
    }
}
