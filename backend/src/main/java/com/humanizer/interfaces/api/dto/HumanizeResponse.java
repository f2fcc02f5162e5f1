package com.humanizer.interfaces.api.dto;

import com.humanizer.domain.rewrite.model.HumanizeResult;

public record HumanizeResponse(
        String originalText,
        String humanizedText,
        int originalWordCount,
        int humanizedWordCount,
        int originalSentenceCount,
        int humanizedSentenceCount,
        String styleUsed
) {
    public static HumanizeResponse from(HumanizeResult result) {
        return new HumanizeResponse(
                result.originalText(),
                result.humanizedText(),
                result.originalWordCount(),
                result.humanizedWordCount(),
                result.originalSentenceCount(),
                result.humanizedSentenceCount(),
                result.styleUsed());
    }
}
