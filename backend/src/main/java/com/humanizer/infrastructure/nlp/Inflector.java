package com.humanizer.infrastructure.nlp;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Regular English inflection, the inverse of {@link Lemmatizer} for the forms the rewriter produces.
 */
@Component
public class Inflector {

    public enum Form { BASE, THIRD_PERSON, PAST, GERUND, PLURAL }

    private static final Pattern DOUBLE_FINAL = Pattern.compile("^[^aeiou]*[aeiou][bdgklmnprt]$");

    private static final Pattern CONSONANT_Y = Pattern.compile(".*[^aeiou]y$");

    private static final Pattern SIBILANT = Pattern.compile(".*(s|x|z|ch|sh)$");

    private static final Map<String, String> IRREGULAR_PAST = Map.ofEntries(
            Map.entry("make", "made"), Map.entry("build", "built"), Map.entry("get", "got"),
            Map.entry("give", "gave"), Map.entry("find", "found"), Map.entry("begin", "began"),
            Map.entry("grow", "grew"), Map.entry("rise", "rose"), Map.entry("sink", "sank"),
            Map.entry("run", "ran"), Map.entry("hold", "held"), Map.entry("keep", "kept"),
            Map.entry("think", "thought"), Map.entry("feel", "felt"), Map.entry("see", "saw"),
            Map.entry("say", "said"), Map.entry("tell", "told"), Map.entry("buy", "bought"),
            Map.entry("cut", "cut"), Map.entry("let", "let"), Map.entry("hit", "hit"),
            Map.entry("seek", "sought"), Map.entry("choose", "chose"), Map.entry("quit", "quit"),
            Map.entry("understand", "understood"), Map.entry("fall", "fell"), Map.entry("shrink", "shrank"),
            Map.entry("teach", "taught"), Map.entry("lead", "led"), Map.entry("leave", "left"),
            Map.entry("send", "sent"), Map.entry("spend", "spent"), Map.entry("win", "won"),
            Map.entry("take", "took"), Map.entry("go", "went"), Map.entry("come", "came"),
            Map.entry("know", "knew"), Map.entry("show", "showed"), Map.entry("put", "put")
    );

    /**
     * Which regular form {@code word} is of {@code lemma}, if any. Irregular forms ("ran", "children") yield empty.
     */
    public Optional<Form> detect(String word, String lemma, boolean noun) {
        if (word.equals(lemma)) {
            return Optional.of(Form.BASE);
        }
        if (noun) {
            return word.equals(inflect(lemma, Form.PLURAL)) ? Optional.of(Form.PLURAL) : Optional.empty();
        }
        for (Form form : new Form[]{Form.THIRD_PERSON, Form.PAST, Form.GERUND}) {
            if (word.equals(regular(lemma, form))) {
                return Optional.of(form);
            }
        }
        return Optional.empty();
    }

    public String inflect(String base, Form form) {
        if (form == Form.PAST && IRREGULAR_PAST.containsKey(base)) {
            return IRREGULAR_PAST.get(base);
        }
        return regular(base, form);
    }

    private static String regular(String base, Form form) {
        return switch (form) {
            case BASE -> base;
            case THIRD_PERSON, PLURAL -> {
                if (CONSONANT_Y.matcher(base).matches()) yield base.substring(0, base.length() - 1) + "ies";
                if (SIBILANT.matcher(base).matches()) yield base + "es";
                if (form == Form.THIRD_PERSON && base.endsWith("o")) yield base + "es";
                yield base + "s";
            }
            case PAST -> {
                if (base.endsWith("e")) yield base + "d";
                if (CONSONANT_Y.matcher(base).matches()) yield base.substring(0, base.length() - 1) + "ied";
                if (DOUBLE_FINAL.matcher(base).matches()) yield base + base.charAt(base.length() - 1) + "ed";
                yield base + "ed";
            }
            case GERUND -> {
                if (base.endsWith("ie")) yield base.substring(0, base.length() - 2) + "ying";
                if (base.endsWith("e") && !base.endsWith("ee") && !base.endsWith("ye") && !base.endsWith("oe")) {
                    yield base.substring(0, base.length() - 1) + "ing";
                }
                if (DOUBLE_FINAL.matcher(base).matches()) yield base + base.charAt(base.length() - 1) + "ing";
                yield base + "ing";
            }
        };
    }
}
