package com.humanizer.domain.language.model;

/**
 * A lexical alternative for a word, with its relative usage frequency (higher is more common).
 */
public record SynonymCandidate(
        String word,
        int frequency
) {}
