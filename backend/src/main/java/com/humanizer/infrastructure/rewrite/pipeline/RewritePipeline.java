package com.humanizer.infrastructure.rewrite.pipeline;

import com.humanizer.domain.language.service.LinguisticAnnotator;
import com.humanizer.domain.rewrite.model.HumanizeResult;
import com.humanizer.domain.rewrite.model.PipelineStage;
import com.humanizer.domain.rewrite.model.RewriteConfiguration;
import com.humanizer.domain.rewrite.model.StyleProfile;
import com.humanizer.infrastructure.nlp.SentenceSplitter;
import com.humanizer.infrastructure.nlp.TextStatistics;
import com.humanizer.infrastructure.rewrite.pass.ClauseReorderer;
import com.humanizer.infrastructure.rewrite.pass.ContractionHandler;
import com.humanizer.infrastructure.rewrite.pass.HedgingInjector;
import com.humanizer.infrastructure.rewrite.pass.ImperfectionInjector;
import com.humanizer.infrastructure.rewrite.pass.LexicalSubstitutor;
import com.humanizer.infrastructure.rewrite.pass.SentenceCombiner;
import com.humanizer.infrastructure.rewrite.pass.StyleVariator;
import com.humanizer.infrastructure.rewrite.pass.TransitionSelector;
import com.humanizer.infrastructure.rewrite.preprocessing.CitationGuard;
import com.humanizer.infrastructure.rewrite.preprocessing.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Orchestrates one rewrite:
 * <p>
 * extract citations → split → per-sentence passes → combine / vary → restore citations → normalize → done
 * </p>
 * Per-sentence order: contraction → clause reordering → lexical substitution → hedging → transition → imperfections.
 * A pass that throws is logged and skipped; the sentence keeps its previous form.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RewritePipeline {

    private final CitationGuard citationGuard;
    private final SentenceSplitter sentenceSplitter;
    private final TextNormalizer textNormalizer;
    private final TextStatistics textStatistics;
    private final LinguisticAnnotator annotator;
    private final ContractionHandler contractionHandler;
    private final ClauseReorderer clauseReorderer;
    private final LexicalSubstitutor lexicalSubstitutor;
    private final HedgingInjector hedgingInjector;
    private final TransitionSelector transitionSelector;
    private final ImperfectionInjector imperfectionInjector;
    private final SentenceCombiner sentenceCombiner;
    private final StyleVariator styleVariator;

    public HumanizeResult execute(String text, RewriteConfiguration configuration, Random random) {
        String original = text == null ? "" : text;
        if (original.isBlank()) {
            return new HumanizeResult(original, "", 0, 0, 0, 0, configuration.styleName());
        }

        RewritePipelineContext ctx = new RewritePipelineContext();
        ctx.setOriginalText(original);
        ctx.setConfiguration(configuration);
        ctx.setRandom(random);

        if (!annotator.isAvailable()) {
            log.warn("[Pipeline] Annotator unavailable, skipping substitution, hedging, restructuring and style variation");
        }

        // 1. Shield citations
        ctx.setCitations(citationGuard.extract(original));
        ctx.advanceTo(PipelineStage.CITATIONS_EXTRACTED);

        // 2. Per-sentence passes
        transformSentences(ctx);
        ctx.advanceTo(PipelineStage.PER_SENTENCE_TRANSFORMED);

        // 3. Cross-sentence passes
        recombine(ctx);
        ctx.advanceTo(PipelineStage.RECOMBINED);

        // 4. Restore citations
        ctx.setRestoredText(citationGuard.restore(ctx.getRewrittenText(), ctx.getCitations()));
        ctx.advanceTo(PipelineStage.CITATIONS_RESTORED);

        // 5. Normalize punctuation around, never inside, citations
        ctx.setNormalizedText(textNormalizer.normalizePunctuation(
                ctx.getRestoredText(), ctx.getCitations().originalTexts()));
        ctx.advanceTo(PipelineStage.NORMALIZED);

        HumanizeResult result = buildResult(ctx);
        ctx.advanceTo(PipelineStage.DONE);

        log.debug("[Pipeline] Done: style={}, words {}→{}, sentences {}→{}, absorbed failures={}",
                result.styleUsed(), result.originalWordCount(), result.humanizedWordCount(),
                result.originalSentenceCount(), result.humanizedSentenceCount(), ctx.getAbsorbedFailures());
        return result;
    }

    private void transformSentences(RewritePipelineContext ctx) {
        StyleProfile profile = ctx.profile();
        Random random = ctx.getRandom();
        String previous = null;

        for (String paragraph : sentenceSplitter.paragraphs(ctx.getCitations().maskedText())) {
            List<String> rewritten = new ArrayList<>();
            for (String sentence : sentenceSplitter.split(paragraph)) {
                String current = sentence;
                String prev = previous;

                current = guarded(ctx, "contraction", current,
                        s -> contractionHandler.apply(s, profile.expandContractions(), profile.addContractions(), random));
                current = guarded(ctx, "restructure", current,
                        s -> clauseReorderer.restructure(s, profile.sentenceRestructure(), random));
                current = guarded(ctx, "substitution", current,
                        s -> lexicalSubstitutor.substitute(s, profile.synonymProbability(), profile.synonymFormality(), random));
                current = guarded(ctx, "hedging", current,
                        s -> hedgingInjector.hedge(s, profile.hedgingProbability(), random));
                current = guarded(ctx, "transition", current,
                        s -> transitionSelector.addTransition(s, prev, ctx.getTransitionMemory(),
                                profile.transitionProbability(), profile.transitionStyle(), random));
                if (profile.humanImperfections()) {
                    current = guarded(ctx, "imperfections", current, s -> imperfectionInjector.inject(s, random));
                }

                rewritten.add(current);
                previous = sentence;
            }
            ctx.getParagraphs().add(rewritten);
        }
        log.debug("[Pipeline] Transformed {} paragraph(s)", ctx.getParagraphs().size());
    }

    private void recombine(RewritePipelineContext ctx) {
        StyleProfile profile = ctx.profile();
        Random random = ctx.getRandom();
        List<String> paragraphs = new ArrayList<>();

        for (List<String> sentences : ctx.getParagraphs()) {
            List<String> combined = guardedList(ctx, "combination", sentences,
                    () -> sentenceCombiner.varyLength(sentences, profile.sentenceCombineProbability(), random));
            List<String> varied = guardedList(ctx, "style variation", combined,
                    () -> styleVariator.vary(combined, profile.styleVariation(), random));
            paragraphs.add(String.join(" ", varied));
        }
        ctx.setRewrittenText(String.join("\n\n", paragraphs));
    }

    private HumanizeResult buildResult(RewritePipelineContext ctx) {
        String original = ctx.getOriginalText();
        String humanized = ctx.getNormalizedText();
        return new HumanizeResult(
                original,
                humanized,
                textStatistics.countWords(original),
                textStatistics.countWords(humanized),
                textStatistics.countSentences(original),
                textStatistics.countSentences(humanized),
                ctx.getConfiguration().styleName()
        );
    }

    private String guarded(RewritePipelineContext ctx, String pass, String sentence,
                           UnaryOperator<String> operation) {
        try {
            String result = operation.apply(sentence);
            return result != null ? result : sentence;
        } catch (RuntimeException e) {
            log.warn("[Pipeline] Pass '{}' failed, sentence left unchanged: {}", pass, e.getMessage(), e);
            ctx.recordAbsorbedFailure();
            return sentence;
        }
    }

    private List<String> guardedList(RewritePipelineContext ctx, String pass, List<String> sentences,
                                     Supplier<List<String>> operation) {
        try {
            List<String> result = operation.get();
            return result != null ? result : sentences;
        } catch (RuntimeException e) {
            log.warn("[Pipeline] Pass '{}' failed, sentences left unchanged: {}", pass, e.getMessage(), e);
            ctx.recordAbsorbedFailure();
            return sentences;
        }
    }
}
