package com.humanizer.interfaces.api.dto;

import com.humanizer.domain.rewrite.model.StyleProfile;

public record StyleProfileResponse(
        String name,
        double synonymProbability,
        double transitionProbability,
        double hedgingProbability,
        double sentenceCombineProbability,
        String synonymFormality,
        String transitionStyle,
        boolean expandContractions,
        boolean addContractions,
        boolean humanImperfections,
        double styleVariation,
        double sentenceRestructure
) {
    public static StyleProfileResponse of(String name, StyleProfile profile) {
        return new StyleProfileResponse(
                name,
                profile.synonymProbability(),
                profile.transitionProbability(),
                profile.hedgingProbability(),
                profile.sentenceCombineProbability(),
                profile.synonymFormality().key(),
                profile.transitionStyle(),
                profile.expandContractions(),
                profile.addContractions(),
                profile.humanImperfections(),
                profile.styleVariation(),
                profile.sentenceRestructure());
    }
}
