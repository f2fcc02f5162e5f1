package com.humanizer.domain.language.model;

/**
 * A named-entity mention inside a sentence.
 */
public record EntitySpan(
        String text,
        int start,
        int end
) {}
