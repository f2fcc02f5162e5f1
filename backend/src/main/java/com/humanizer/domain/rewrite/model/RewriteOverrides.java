package com.humanizer.domain.rewrite.model;

/**
 * Caller-supplied partial configuration. A null field keeps the profile default.
 */
public record RewriteOverrides(
        Double synonymProbability,
        Double transitionProbability,
        Double hedgingProbability,
        Double sentenceCombineProbability,
        SynonymFormality synonymFormality,
        String transitionStyle,
        Boolean expandContractions,
        Boolean addContractions,
        Boolean humanImperfections,
        Double styleVariation,
        Double sentenceRestructure
) {

    public static RewriteOverrides none() {
        return new RewriteOverrides(null, null, null, null, null, null, null, null, null, null, null);
    }

    /**
     * Overrides for the four headline probabilities only.
     */
    public static RewriteOverrides ofProbabilities(Double synonymProbability,
                                                   Double transitionProbability,
                                                   Double hedgingProbability,
                                                   Double sentenceCombineProbability) {
        return new RewriteOverrides(synonymProbability, transitionProbability, hedgingProbability,
                sentenceCombineProbability, null, null, null, null, null, null, null);
    }
}
