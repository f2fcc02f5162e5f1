package com.humanizer.domain.language.model;

import java.util.Locale;

/**
 * One annotated token of a sentence.
 *
 * @param text    the surface form as it appears in the sentence
 * @param pos     part-of-speech tag
 * @param depRole dependency role
 * @param lemma   lower-case dictionary form
 * @param index   0-based token position
 * @param start   character offset in the sentence
 * @param end     character offset (exclusive) in the sentence
 */
public record Token(
        String text,
        PartOfSpeech pos,
        DependencyRole depRole,
        String lemma,
        int index,
        int start,
        int end
) {
    public String lower() {
        return text.toLowerCase(Locale.ROOT);
    }

    public boolean isWord() {
        return pos != PartOfSpeech.PUNCT && pos != PartOfSpeech.X;
    }

    public Token withPos(PartOfSpeech newPos) {
        return new Token(text, newPos, depRole, lemma, index, start, end);
    }

    public Token withDepRole(DependencyRole role) {
        return new Token(text, pos, role, lemma, index, start, end);
    }

    public Token withLemma(String newLemma) {
        return new Token(text, pos, depRole, newLemma, index, start, end);
    }
}
