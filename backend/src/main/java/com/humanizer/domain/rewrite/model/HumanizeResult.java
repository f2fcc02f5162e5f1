package com.humanizer.domain.rewrite.model;

/**
 * Final output of one rewrite call.
 */
public record HumanizeResult(
        String originalText,
        String humanizedText,
        int originalWordCount,
        int humanizedWordCount,
        int originalSentenceCount,
        int humanizedSentenceCount,
        String styleUsed
) {}
