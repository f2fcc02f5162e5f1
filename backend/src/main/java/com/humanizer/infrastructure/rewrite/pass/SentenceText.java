package com.humanizer.infrastructure.rewrite.pass;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * String-level helpers shared by the rewrite passes. Stateless.
 */
public final class SentenceText {

    private SentenceText() {
    }

    public static final Pattern PLACEHOLDER = Pattern.compile("\\[\\s*\\[\\s*REF_\\d+\\s*\\]\\s*\\]");

    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}]+(?:['’\\-][\\p{L}\\p{N}]+)*");

    private static final Pattern LEADING_WORD = Pattern.compile("^[\"'“‘(]*([A-Za-z]+(?:['’][A-Za-z]+)?)");

    private static final Pattern TERMINAL = Pattern.compile("([.!?]+)([\"'”’)]*)\\s*$");

    private static final Set<String> I_FORMS = Set.of("i", "i'm", "i've", "i'll", "i'd", "i’m", "i’ve", "i’ll", "i’d");

    /**
     * Number of words; a citation placeholder counts as one word.
     */
    public static int wordCount(String sentence) {
        if (sentence == null || sentence.isBlank()) {
            return 0;
        }
        String flattened = PLACEHOLDER.matcher(sentence).replaceAll(" REF ");
        int count = 0;
        Matcher m = WORD.matcher(flattened);
        while (m.find()) {
            count++;
        }
        return count;
    }

    /**
     * Lower-case first word of the sentence, ignoring leading quotes, or "" if it does not open with a word.
     */
    public static String firstWord(String sentence) {
        if (sentence == null) {
            return "";
        }
        Matcher m = LEADING_WORD.matcher(sentence.stripLeading());
        return m.find() ? m.group(1).toLowerCase(Locale.ROOT).replace('’', '\'') : "";
    }

    public static boolean startsWithPlaceholder(String sentence) {
        return sentence != null && PLACEHOLDER.matcher(sentence.stripLeading()).lookingAt();
    }

    public static boolean containsPlaceholder(String sentence) {
        return sentence != null && PLACEHOLDER.matcher(sentence).find();
    }

    /**
     * Lower-case the first letter so the sentence can follow a connector or transition.
     * "I" and its contractions, acronyms, mixed-case identifiers, proper nouns and placeholders keep their case.
     */
    public static String lowercaseFirst(String sentence, boolean opensWithProperNoun) {
        if (sentence == null || sentence.isEmpty() || opensWithProperNoun || startsWithPlaceholder(sentence)) {
            return sentence;
        }
        Matcher m = LEADING_WORD.matcher(sentence);
        if (!m.find()) {
            return sentence;
        }
        String word = m.group(1);
        if (I_FORMS.contains(word.toLowerCase(Locale.ROOT))) {
            return sentence;
        }
        // only plain capitalized words: "The", not "NASA" or "iOS" or "McDonald"
        if (!Character.isUpperCase(word.charAt(0)) || !word.substring(1).equals(word.substring(1).toLowerCase(Locale.ROOT))) {
            return sentence;
        }
        int at = m.start(1);
        return sentence.substring(0, at) + Character.toLowerCase(word.charAt(0)) + sentence.substring(at + 1);
    }

    public static String capitalizeFirst(String sentence) {
        if (sentence == null) {
            return null;
        }
        for (int i = 0; i < sentence.length(); i++) {
            char c = sentence.charAt(i);
            if (Character.isLetter(c)) {
                if (Character.isUpperCase(c)) {
                    return sentence;
                }
                return sentence.substring(0, i) + Character.toUpperCase(c) + sentence.substring(i + 1);
            }
            if (c == '[') {
                // placeholder first
                return sentence;
            }
        }
        return sentence;
    }

    /**
     * Remove terminal punctuation ("." "!" "?" and runs of them), keeping any closing quote or bracket.
     */
    public static String stripTerminalPunctuation(String sentence) {
        Matcher m = TERMINAL.matcher(sentence);
        if (m.find()) {
            return sentence.substring(0, m.start()) + m.group(2);
        }
        return sentence.stripTrailing();
    }

    /**
     * The terminal punctuation run of the sentence, or "" if it has none.
     */
    public static String terminalPunctuation(String sentence) {
        Matcher m = TERMINAL.matcher(sentence);
        return m.find() ? m.group(1) : "";
    }

    public static boolean isQuestion(String sentence) {
        return sentence != null && sentence.stripTrailing().endsWith("?");
    }

    /**
     * Whole-word, case-insensitive phrase search.
     */
    public static boolean containsPhrase(String sentence, String phrase) {
        return Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(phrase) + "(?![\\p{L}\\p{N}])",
                Pattern.CASE_INSENSITIVE).matcher(sentence).find();
    }

    /**
     * Whether the sentence opens with the phrase as whole words, case-insensitively, ignoring leading quotes.
     */
    public static boolean opensWith(String sentence, String phrase) {
        String s = sentence.stripLeading().replaceFirst("^[\"'“‘(]+", "");
        if (s.length() < phrase.length() || !s.regionMatches(true, 0, phrase, 0, phrase.length())) {
            return false;
        }
        if (s.length() == phrase.length()) {
            return true;
        }
        char after = s.charAt(phrase.length());
        return !Character.isLetterOrDigit(after) || !Character.isLetterOrDigit(phrase.charAt(phrase.length() - 1));
    }
}
