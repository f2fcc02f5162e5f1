package com.humanizer.infrastructure.rewrite.preprocessing;

import com.humanizer.domain.rewrite.model.CitationExtraction;
import com.humanizer.domain.rewrite.model.CitationSpan;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Swaps citations for {@code [[REF_n]]} placeholders before rewriting and puts them back afterwards.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CitationGuard {

    // Tolerates spacing drift introduced by rewriting: [[REF_1]], [ [ REF_1 ] ], [[ REF_1]]
    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile(
            "\\[\\s*\\[\\s*REF_(\\d+)\\s*\\]\\s*\\]"
    );

    private final CitationExtractor extractor;

    /**
     * Replace every citation in the text with its placeholder.
     */
    public CitationExtraction extract(String text) {
        List<CitationSpan> spans = extractor.extract(text);
        if (spans.isEmpty()) {
            return CitationExtraction.none(text);
        }

        StringBuilder sb = new StringBuilder();
        int lastEnd = 0;
        for (CitationSpan span : spans) {
            sb.append(text, lastEnd, span.startPos());
            sb.append(span.placeholder());
            lastEnd = span.endPos();
        }
        sb.append(text, lastEnd, text.length());

        log.debug("[CitationGuard] Extracted {} citation(s)", spans.size());
        return new CitationExtraction(sb.toString(), List.copyOf(spans));
    }

    /**
     * Restore placeholders with the original citation text. Unknown placeholders are left as they are.
     */
    public String restore(String text, CitationExtraction extraction) {
        if (text == null || extraction == null || !extraction.hasCitations()) {
            return text;
        }

        Map<String, CitationSpan> byCounter = new HashMap<>();
        for (CitationSpan span : extraction.citations()) {
            byCounter.put(String.valueOf(span.index()), span);
        }

        Set<Integer> restored = new HashSet<>();
        Matcher matcher = PLACEHOLDER_PATTERN.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            CitationSpan span = byCounter.get(matcher.group(1));
            if (span != null) {
                matcher.appendReplacement(sb, Matcher.quoteReplacement(span.originalText()));
                restored.add(span.index());
            } else {
                log.warn("[CitationGuard] Placeholder {} has no recorded citation, left untouched", matcher.group());
                matcher.appendReplacement(sb, Matcher.quoteReplacement(matcher.group()));
            }
        }
        matcher.appendTail(sb);

        for (CitationSpan span : extraction.citations()) {
            if (!restored.contains(span.index())) {
                log.warn("[CitationGuard] Citation missing after rewrite: placeholder={}, text='{}'",
                        span.placeholder(), span.originalText());
            }
        }
        return sb.toString();
    }
}
