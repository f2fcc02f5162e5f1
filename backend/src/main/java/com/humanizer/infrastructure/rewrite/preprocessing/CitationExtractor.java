package com.humanizer.infrastructure.rewrite.preprocessing;

import com.humanizer.domain.rewrite.model.CitationSpan;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds parenthesized author-year citations: "(Smith, 2020)", "(Smith & Jones, 2019)",
 * "(Smith et al., 2021, p. 4)", "(Lee, 2018, pp. 10-12)".
 * <p>
 * Matches are non-overlapping and numbered left to right from 1.
 */
@Component
public class CitationExtractor {

    static final Pattern CITATION_PATTERN = Pattern.compile(
            "\\(\\s*[A-Za-z&\\-,.\\s]+(?:et al\\.\\s*)?,\\s*\\d{4}(?:,\\s*pp?\\.\\s*\\d+(?:-\\d+)?)?\\s*\\)"
    );

    public static String placeholderFor(int index) {
        return "[[REF_" + index + "]]";
    }

    /**
     * @param text the input text
     * @return citations sorted by position, empty if none
     */
    public List<CitationSpan> extract(String text) {
        List<CitationSpan> spans = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return spans;
        }

        Matcher m = CITATION_PATTERN.matcher(text);
        int index = 1;
        while (m.find()) {
            spans.add(new CitationSpan(index, m.group(), placeholderFor(index), m.start(), m.end()));
            index++;
        }
        return spans;
    }
}
