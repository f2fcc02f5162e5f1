package com.humanizer.domain.rewrite.model;

/**
 * A bibliographic citation found in the input, shielded from every rewrite pass.
 *
 * @param index        1-based sequence number, left to right
 * @param originalText the exact substring matched in the input
 * @param placeholder  the placeholder standing in for it, e.g. "[[REF_1]]"
 * @param startPos     start position in the input
 * @param endPos       end position (exclusive) in the input
 */
public record CitationSpan(
        int index,
        String originalText,
        String placeholder,
        int startPos,
        int endPos
) {}
