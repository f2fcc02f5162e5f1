package com.humanizer.interfaces.api.dto;

import com.humanizer.domain.rewrite.exception.InvalidConfigurationException;
import com.humanizer.domain.rewrite.model.RewriteOverrides;
import com.humanizer.domain.rewrite.model.SynonymFormality;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;

public record HumanizeRequest(
        @NotBlank(message = "Text is required")
        String text,

        String style,

        @DecimalMin(value = "0.0", message = "synonymProbability must be between 0 and 1")
        @DecimalMax(value = "1.0", message = "synonymProbability must be between 0 and 1")
        Double synonymProbability,

        @DecimalMin(value = "0.0", message = "transitionProbability must be between 0 and 1")
        @DecimalMax(value = "1.0", message = "transitionProbability must be between 0 and 1")
        Double transitionProbability,

        @DecimalMin(value = "0.0", message = "hedgingProbability must be between 0 and 1")
        @DecimalMax(value = "1.0", message = "hedgingProbability must be between 0 and 1")
        Double hedgingProbability,

        @DecimalMin(value = "0.0", message = "sentenceCombineProbability must be between 0 and 1")
        @DecimalMax(value = "1.0", message = "sentenceCombineProbability must be between 0 and 1")
        Double sentenceCombineProbability,

        String synonymFormality,

        String transitionStyle,

        Boolean expandContractions,

        Boolean addContractions,

        Boolean humanImperfections,

        @DecimalMin(value = "0.0", message = "styleVariation must be between 0 and 1")
        @DecimalMax(value = "1.0", message = "styleVariation must be between 0 and 1")
        Double styleVariation,

        @DecimalMin(value = "0.0", message = "sentenceRestructure must be between 0 and 1")
        @DecimalMax(value = "1.0", message = "sentenceRestructure must be between 0 and 1")
        Double sentenceRestructure
) {

    /**
     * @throws InvalidConfigurationException when synonymFormality is not a known register
     */
    public RewriteOverrides toOverrides() {
        return new RewriteOverrides(
                synonymProbability,
                transitionProbability,
                hedgingProbability,
                sentenceCombineProbability,
                parseFormality(synonymFormality),
                transitionStyle,
                expandContractions,
                addContractions,
                humanImperfections,
                styleVariation,
                sentenceRestructure);
    }

    private static SynonymFormality parseFormality(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return SynonymFormality.fromKey(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("Unknown synonymFormality: '" + value
                    + "'. Expected one of formal, casual, neutral, varied");
        }
    }
}
