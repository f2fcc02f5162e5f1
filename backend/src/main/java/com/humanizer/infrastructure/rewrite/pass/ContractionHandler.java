package com.humanizer.infrastructure.rewrite.pass;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands contractions ("don't" → "do not") or inserts them ("do not" → "don't").
 * Possessive "'s" is never expanded: only pronoun + 's ("it's", "that's") reads as "is".
 */
@Slf4j
@Component
public class ContractionHandler {

    /** Chance that each contraction opportunity is taken when inserting. */
    static final double INSERT_PROBABILITY = 0.6;

    private static final String APOS = "['’]";

    private static final Pattern IRREGULAR_NEGATION = Pattern.compile(
            "\\b(can|won|shan|ain)" + APOS + "t\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern NEGATION = Pattern.compile(
            "\\b([A-Za-z]+)n" + APOS + "t\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern SUFFIX = Pattern.compile(
            "\\b([A-Za-z]+)" + APOS + "(re|ll|ve|m|d)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern PRONOUN_IS = Pattern.compile(
            "\\b(it|that|what|there|here|he|she|who|where|how)" + APOS + "s\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern LET_US = Pattern.compile("\\b(let)" + APOS + "s\\b", Pattern.CASE_INSENSITIVE);

    private static final Map<String, String> SUFFIX_EXPANSIONS = Map.of(
            "re", "are", "ll", "will", "ve", "have", "m", "am", "d", "would");

    private static final Map<String, String> IRREGULAR_EXPANSIONS = Map.of(
            "can", "cannot", "won", "will not", "shan", "shall not", "ain", "is not");

    // longest phrases first so "can not" wins over shorter overlaps
    private static final Map<String, String> CONTRACTIONS = new LinkedHashMap<>();

    static {
        CONTRACTIONS.put("should not", "shouldn't");
        CONTRACTIONS.put("would not", "wouldn't");
        CONTRACTIONS.put("could not", "couldn't");
        CONTRACTIONS.put("does not", "doesn't");
        CONTRACTIONS.put("were not", "weren't");
        CONTRACTIONS.put("have not", "haven't");
        CONTRACTIONS.put("will not", "won't");
        CONTRACTIONS.put("are not", "aren't");
        CONTRACTIONS.put("was not", "wasn't");
        CONTRACTIONS.put("has not", "hasn't");
        CONTRACTIONS.put("had not", "hadn't");
        CONTRACTIONS.put("did not", "didn't");
        CONTRACTIONS.put("can not", "can't");
        CONTRACTIONS.put("is not", "isn't");
        CONTRACTIONS.put("do not", "don't");
        CONTRACTIONS.put("cannot", "can't");
        CONTRACTIONS.put("they are", "they're");
        CONTRACTIONS.put("they will", "they'll");
        CONTRACTIONS.put("there is", "there's");
        CONTRACTIONS.put("that is", "that's");
        CONTRACTIONS.put("you are", "you're");
        CONTRACTIONS.put("you will", "you'll");
        CONTRACTIONS.put("we are", "we're");
        CONTRACTIONS.put("we will", "we'll");
        CONTRACTIONS.put("it is", "it's");
        CONTRACTIONS.put("it will", "it'll");
        CONTRACTIONS.put("i am", "I'm");
        CONTRACTIONS.put("i will", "I'll");
    }

    private static final Pattern CONTRACTIBLE;

    static {
        StringBuilder alternatives = new StringBuilder();
        for (String phrase : CONTRACTIONS.keySet()) {
            if (!alternatives.isEmpty()) {
                alternatives.append('|');
            }
            alternatives.append(phrase.replace(" ", "\\s+"));
        }
        CONTRACTIBLE = Pattern.compile("\\b(?:" + alternatives + ")\\b", Pattern.CASE_INSENSITIVE);
    }

    // contraction directly before punctuation or the end reads badly: "I know what it's."
    private static final Pattern CLAUSE_END = Pattern.compile("^\\s*(?:[.,;:!?)\"”]|$)");

    /**
     * Insertion wins when both flags are set.
     */
    public String apply(String sentence, boolean expand, boolean add, Random random) {
        if (add) {
            return contract(sentence, random);
        }
        if (expand) {
            return expand(sentence);
        }
        return sentence;
    }

    public String expand(String sentence) {
        if (sentence == null || sentence.indexOf('\'') < 0 && sentence.indexOf('’') < 0) {
            return sentence;
        }
        String result = replace(IRREGULAR_NEGATION, sentence, m -> {
            String host = m.group(1);
            return matchCase(host, IRREGULAR_EXPANSIONS.get(host.toLowerCase(Locale.ROOT)));
        });
        result = replace(NEGATION, result, m -> m.group(1) + " not");
        result = replace(SUFFIX, result,
                m -> m.group(1) + " " + SUFFIX_EXPANSIONS.get(m.group(2).toLowerCase(Locale.ROOT)));
        result = replace(PRONOUN_IS, result, m -> m.group(1) + " is");
        result = replace(LET_US, result, m -> m.group(1) + " us");
        return result;
    }

    public String contract(String sentence, Random random) {
        if (sentence == null || sentence.isEmpty()) {
            return sentence;
        }
        Matcher m = CONTRACTIBLE.matcher(sentence);
        StringBuilder sb = new StringBuilder();
        int taken = 0;
        while (m.find()) {
            String phrase = m.group();
            if (CLAUSE_END.matcher(sentence.substring(m.end())).find() || random.nextDouble() >= INSERT_PROBABILITY) {
                m.appendReplacement(sb, Matcher.quoteReplacement(phrase));
                continue;
            }
            String key = phrase.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
            m.appendReplacement(sb, Matcher.quoteReplacement(matchCase(phrase, CONTRACTIONS.get(key))));
            taken++;
        }
        m.appendTail(sb);
        if (taken > 0) {
            log.debug("[Contraction] Inserted {} contraction(s)", taken);
        }
        return sb.toString();
    }

    private static String replace(Pattern pattern, String text, Function<Matcher, String> replacement) {
        Matcher m = pattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement.apply(m)));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    // "Do not" → "Don't", "I am" → "I'm"
    private static String matchCase(String original, String replacement) {
        if (Character.isUpperCase(original.charAt(0)) && Character.isLowerCase(replacement.charAt(0))) {
            return Character.toUpperCase(replacement.charAt(0)) + replacement.substring(1);
        }
        return replacement;
    }
}
