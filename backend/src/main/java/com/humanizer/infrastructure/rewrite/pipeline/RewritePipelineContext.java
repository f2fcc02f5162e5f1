package com.humanizer.infrastructure.rewrite.pipeline;

import com.humanizer.domain.rewrite.model.CitationExtraction;
import com.humanizer.domain.rewrite.model.PipelineStage;
import com.humanizer.domain.rewrite.model.RewriteConfiguration;
import com.humanizer.domain.rewrite.model.StyleProfile;
import com.humanizer.infrastructure.rewrite.pass.TransitionMemory;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Mutable state of one rewrite call, passed through the pipeline stages.
 */
@Data
public class RewritePipelineContext {

    // --- Input ---
    private String originalText;
    private RewriteConfiguration configuration;
    private Random random;

    // --- Progress ---
    private PipelineStage stage = PipelineStage.RAW;
    private int absorbedFailures;

    // --- Citations ---
    private CitationExtraction citations;

    // --- Sentences, one list per paragraph ---
    private List<List<String>> paragraphs = new ArrayList<>();
    private TransitionMemory transitionMemory = new TransitionMemory();

    // --- Output ---
    private String rewrittenText;
    private String restoredText;
    private String normalizedText;

    public StyleProfile profile() {
        return configuration.profile();
    }

    /**
     * Move to the next stage. Stages only ever advance one step at a time.
     */
    public void advanceTo(PipelineStage next) {
        if (stage.next() != next) {
            throw new IllegalStateException("Cannot move from " + stage + " to " + next);
        }
        stage = next;
    }

    public void recordAbsorbedFailure() {
        absorbedFailures++;
    }
}
