package com.humanizer.infrastructure.rewrite.pass;

/**
 * Hedging strategies in the order they are tried. Each has its own trigger probability;
 * the first one that fires and applies wins.
 */
public enum HedgeStrategy {
    /** "proves" → "suggests", "will" → "may" */
    MODAL_SUBSTITUTION(0.30),
    /** "The method improves" → "The method often improves" */
    FREQUENCY_ADVERB(0.25),
    /** "a significant gain" → "a relatively significant gain" */
    APPROXIMATOR(0.20),
    /** "It is fast" → "It is probably fast" */
    EPISTEMIC_ADVERB(0.15),
    /** "In many cases, ..." */
    SCOPE_LIMITER(0.10);

    private final double triggerProbability;

    HedgeStrategy(double triggerProbability) {
        this.triggerProbability = triggerProbability;
    }

    public double triggerProbability() {
        return triggerProbability;
    }
}
