package com.humanizer.domain.language.model;

/**
 * Universal part-of-speech tags.
 */
public enum PartOfSpeech {
    ADJ,
    ADP,
    ADV,
    AUX,
    CCONJ,
    DET,
    INTJ,
    NOUN,
    NUM,
    PART,
    PRON,
    PROPN,
    PUNCT,
    SCONJ,
    VERB,
    X;

    /**
     * Adjectives, nouns, verbs and adverbs carry the lexical content of a sentence.
     */
    public boolean isContent() {
        return this == ADJ || this == NOUN || this == VERB || this == ADV;
    }

    public boolean isNominal() {
        return this == NOUN || this == PROPN || this == PRON;
    }
}
