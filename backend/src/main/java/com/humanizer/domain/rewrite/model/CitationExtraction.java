package com.humanizer.domain.rewrite.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Text with its citations replaced by placeholders, plus the spans needed to put them back.
 *
 * @param maskedText text in which every citation reads {@code [[REF_n]]}
 * @param citations  extracted citations in order of appearance, n = 1, 2, ...
 */
public record CitationExtraction(
        String maskedText,
        List<CitationSpan> citations
) {

    public static CitationExtraction none(String text) {
        return new CitationExtraction(text, List.of());
    }

    public boolean hasCitations() {
        return !citations.isEmpty();
    }

    /**
     * Ordered placeholder to original-citation mapping.
     */
    public Map<String, String> placeholderMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for (CitationSpan span : citations) {
            map.put(span.placeholder(), span.originalText());
        }
        return Collections.unmodifiableMap(map);
    }

    public List<String> originalTexts() {
        return citations.stream().map(CitationSpan::originalText).toList();
    }
}
