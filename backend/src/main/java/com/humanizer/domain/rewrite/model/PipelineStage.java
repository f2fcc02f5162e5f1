package com.humanizer.domain.rewrite.model;

/**
 * Linear stages of one rewrite call. No branching, no retry.
 */
public enum PipelineStage {
    RAW,
    CITATIONS_EXTRACTED,
    PER_SENTENCE_TRANSFORMED,
    RECOMBINED,
    CITATIONS_RESTORED,
    NORMALIZED,
    DONE;

    public PipelineStage next() {
        if (this == DONE) {
            throw new IllegalStateException("DONE is terminal");
        }
        return values()[ordinal() + 1];
    }
}
