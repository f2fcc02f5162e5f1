package com.humanizer.domain.rewrite.model;

/**
 * Outcome of trying to merge two adjacent sentences.
 *
 * @param merged       the merged sentence, or null when no merge happened
 * @param relationship the relationship that decided the outcome
 */
public record CombineResult(
        String merged,
        SentenceRelationship relationship
) {
    public static CombineResult refused(SentenceRelationship relationship) {
        return new CombineResult(null, relationship);
    }

    public boolean success() {
        return merged != null;
    }
}
