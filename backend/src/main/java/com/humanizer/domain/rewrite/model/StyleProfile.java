package com.humanizer.domain.rewrite.model;

/**
 * Immutable bundle of rewrite parameters controlling tone and aggressiveness.
 *
 * @param synonymProbability         chance that an eligible content word is replaced
 * @param transitionProbability      chance that a sentence receives a transition prefix
 * @param hedgingProbability         chance that a sentence is considered for hedging
 * @param sentenceCombineProbability chance that an eligible short sentence is merged with its successor
 * @param synonymFormality           register preference for synonym ranking
 * @param transitionStyle            key into the transition catalog
 * @param expandContractions         expand "don't" into "do not"
 * @param addContractions            contract "do not" into "don't" (wins over expansion)
 * @param humanImperfections         allow doubled spaces, dropped serial commas and filler words
 * @param styleVariation             chance to vary the opening of a sentence that repeats its predecessor's first word
 * @param sentenceRestructure        chance to front a trailing prepositional phrase
 */
public record StyleProfile(
        double synonymProbability,
        double transitionProbability,
        double hedgingProbability,
        double sentenceCombineProbability,
        SynonymFormality synonymFormality,
        String transitionStyle,
        boolean expandContractions,
        boolean addContractions,
        boolean humanImperfections,
        double styleVariation,
        double sentenceRestructure
) {

    /**
     * Derive a copy with every non-null override applied. This profile is left untouched.
     */
    public StyleProfile withOverrides(RewriteOverrides overrides) {
        if (overrides == null) {
            return this;
        }
        return new StyleProfile(
                pick(overrides.synonymProbability(), synonymProbability),
                pick(overrides.transitionProbability(), transitionProbability),
                pick(overrides.hedgingProbability(), hedgingProbability),
                pick(overrides.sentenceCombineProbability(), sentenceCombineProbability),
                pick(overrides.synonymFormality(), synonymFormality),
                pick(overrides.transitionStyle(), transitionStyle),
                pick(overrides.expandContractions(), expandContractions),
                pick(overrides.addContractions(), addContractions),
                pick(overrides.humanImperfections(), humanImperfections),
                pick(overrides.styleVariation(), styleVariation),
                pick(overrides.sentenceRestructure(), sentenceRestructure)
        );
    }

    private static <T> T pick(T override, T fallback) {
        return override != null ? override : fallback;
    }
}
