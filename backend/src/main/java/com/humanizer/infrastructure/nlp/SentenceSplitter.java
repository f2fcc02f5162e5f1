package com.humanizer.infrastructure.nlp;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based English sentence segmentation.
 *
 * Boundaries:
 *   1. Blank lines (paragraph breaks), always
 *   2. Terminal punctuation (.!?) plus closing quotes/brackets, followed by whitespace or end of text
 *
 * A terminal-punctuation boundary is suppressed when it falls inside a citation placeholder or a
 * parenthetical, follows a known abbreviation or a single-letter initial, or is followed by a
 * lowercase letter.
 */
@Slf4j
@Component
public class SentenceSplitter {

    private record ProtectedRange(int start, int end) {
        boolean contains(int pos) {
            return pos > start && pos < end;
        }
    }

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");

    private static final Pattern PLACEHOLDER = Pattern.compile("\\[\\s*\\[\\s*REF_\\d+\\s*\\]\\s*\\]");

    private static final Pattern BOUNDARY = Pattern.compile("[.!?]+[\"')\\]”’]*(?=\\s|$)");

    private static final Pattern LAST_WORD = Pattern.compile("([A-Za-z][A-Za-z.]*)$");

    private static final Pattern NEXT_WORD = Pattern.compile("\\s+([A-Z][A-Za-z']*)");

    // words that start a sentence far more often than they follow an initial
    private static final Set<String> SENTENCE_OPENERS = Set.of(
            "i", "it", "he", "she", "we", "they", "you", "the", "a", "an", "this", "that", "these", "those",
            "there", "my", "our", "his", "her", "their", "its", "but", "and", "so", "then", "however");

    private static final Set<String> ABBREVIATIONS = Set.of(
            "mr", "mrs", "ms", "dr", "prof", "sr", "jr", "st", "al", "e.g", "i.e", "etc", "vs", "fig",
            "figs", "pp", "p", "cf", "inc", "ltd", "co", "corp", "vol", "vols", "approx", "u.s",
            "u.k", "ed", "eds", "eq", "ch", "sec", "dept", "est", "jan", "feb", "mar", "apr", "jun",
            "jul", "aug", "sep", "sept", "oct", "nov", "dec", "a.m", "p.m"
    );

    /**
     * Split text into sentences, trimmed, in order. Blank input yields an empty list.
     */
    public List<String> split(String text) {
        List<String> sentences = new ArrayList<>();
        for (String paragraph : paragraphs(text)) {
            sentences.addAll(splitParagraph(paragraph));
        }
        return sentences;
    }

    /**
     * Split text into non-blank paragraphs separated by blank lines.
     */
    public List<String> paragraphs(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (String block : PARAGRAPH_BREAK.split(text)) {
            if (!block.isBlank()) {
                result.add(block.strip());
            }
        }
        return result;
    }

    private List<String> splitParagraph(String paragraph) {
        List<ProtectedRange> protectedRanges = findProtectedRanges(paragraph);
        List<String> sentences = new ArrayList<>();

        int sentenceStart = 0;
        Matcher m = BOUNDARY.matcher(paragraph);
        while (m.find()) {
            int end = m.end();
            if (isProtected(m.start(), protectedRanges)) {
                continue;
            }
            if (m.group().startsWith(".") && m.group().length() == 1 && followsAbbreviation(paragraph, m.start(), end)) {
                continue;
            }
            if (nextLetterIsLowercase(paragraph, end)) {
                continue;
            }
            addIfPresent(sentences, paragraph.substring(sentenceStart, end));
            sentenceStart = end;
        }
        addIfPresent(sentences, paragraph.substring(sentenceStart));

        log.trace("[Splitter] {} sentence(s) from paragraph of {} chars", sentences.size(), paragraph.length());
        return sentences;
    }

    private static void addIfPresent(List<String> sentences, String candidate) {
        String trimmed = candidate.strip();
        if (!trimmed.isEmpty()) {
            sentences.add(trimmed);
        }
    }

    private static List<ProtectedRange> findProtectedRanges(String text) {
        List<ProtectedRange> ranges = new ArrayList<>();

        Matcher placeholder = PLACEHOLDER.matcher(text);
        while (placeholder.find()) {
            ranges.add(new ProtectedRange(placeholder.start(), placeholder.end()));
        }

        int depth = 0;
        int open = -1;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                if (depth == 0) {
                    open = i;
                }
                depth++;
            } else if (c == ')' && depth > 0) {
                depth--;
                if (depth == 0) {
                    ranges.add(new ProtectedRange(open, i));
                }
            }
        }
        return ranges;
    }

    private static boolean isProtected(int pos, List<ProtectedRange> ranges) {
        for (ProtectedRange range : ranges) {
            if (range.contains(pos)) {
                return true;
            }
        }
        return false;
    }

    private static boolean followsAbbreviation(String text, int dotPos, int after) {
        Matcher m = LAST_WORD.matcher(text.substring(0, dotPos));
        if (!m.find()) {
            return false;
        }
        String word = m.group(1);
        if (word.length() == 1 && Character.isUpperCase(word.charAt(0)) && !word.equals("I")) {
            // initial, as in "J. Smith", unless a new sentence plainly starts: "I got an A. It was easy."
            Matcher next = NEXT_WORD.matcher(text).region(after, text.length());
            return next.lookingAt() && !SENTENCE_OPENERS.contains(next.group(1).toLowerCase(Locale.ROOT));
        }
        return ABBREVIATIONS.contains(word.toLowerCase(Locale.ROOT));
    }

    private static boolean nextLetterIsLowercase(String text, int from) {
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                continue;
            }
            return Character.isLowerCase(c);
        }
        return false;
    }
}
