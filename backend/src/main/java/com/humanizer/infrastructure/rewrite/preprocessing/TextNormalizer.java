package com.humanizer.infrastructure.rewrite.preprocessing;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Final punctuation cleanup of rewritten text:
 * - no whitespace before . , ; : ! ?
 * - no whitespace just inside parentheses
 * <p>
 * Protected spans (restored citations) are copied through untouched; only the text between them is normalized.
 * Doubled spaces between words are left alone.
 */
@Component
public class TextNormalizer {

    // " ." → "."
    private static final Pattern SPACE_BEFORE_PUNCT = Pattern.compile("[ \\t]+([.,;:!?])");

    // "( x" → "(x"
    private static final Pattern SPACE_AFTER_OPEN_PAREN = Pattern.compile("\\([ \\t]+");

    // "x )" → "x)"
    private static final Pattern SPACE_BEFORE_CLOSE_PAREN = Pattern.compile("[ \\t]+\\)");

    public String normalizePunctuation(String text) {
        return normalizePunctuation(text, List.of());
    }

    /**
     * @param text           rewritten text
     * @param protectedSpans substrings that must come out byte-identical, e.g. citations
     * @return normalized text
     */
    public String normalizePunctuation(String text, Collection<String> protectedSpans) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        if (protectedSpans == null || protectedSpans.isEmpty()) {
            return normalizeSegment(text);
        }

        StringBuilder sb = new StringBuilder();
        int pos = 0;
        while (pos < text.length()) {
            int[] next = nextProtected(text, pos, protectedSpans);
            if (next == null) {
                sb.append(normalizeSegment(text.substring(pos)));
                break;
            }
            sb.append(normalizeSegment(text.substring(pos, next[0])));
            sb.append(text, next[0], next[1]);
            pos = next[1];
        }
        return sb.toString();
    }

    private static String normalizeSegment(String segment) {
        String result = SPACE_BEFORE_PUNCT.matcher(segment).replaceAll("$1");
        result = SPACE_AFTER_OPEN_PAREN.matcher(result).replaceAll("(");
        result = SPACE_BEFORE_CLOSE_PAREN.matcher(result).replaceAll(")");
        return result;
    }

    // earliest occurrence of any protected span at or after from; longest wins on ties
    private static int[] nextProtected(String text, int from, Collection<String> protectedSpans) {
        List<int[]> hits = new ArrayList<>();
        for (String span : protectedSpans) {
            if (span == null || span.isEmpty()) {
                continue;
            }
            int idx = text.indexOf(span, from);
            if (idx >= 0) {
                hits.add(new int[]{idx, idx + span.length()});
            }
        }
        int[] best = null;
        for (int[] hit : hits) {
            if (best == null || hit[0] < best[0] || (hit[0] == best[0] && hit[1] > best[1])) {
                best = hit;
            }
        }
        return best;
    }
}
