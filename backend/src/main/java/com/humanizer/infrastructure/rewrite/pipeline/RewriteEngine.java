package com.humanizer.infrastructure.rewrite.pipeline;

import com.humanizer.domain.rewrite.model.HumanizeResult;
import com.humanizer.domain.rewrite.model.RewriteConfiguration;
import com.humanizer.domain.rewrite.model.RewriteOverrides;
import com.humanizer.domain.rewrite.service.HumanizerService;
import com.humanizer.infrastructure.rewrite.style.StyleProfileRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Random;

/**
 * Single entry point of the rewriter. Configuration is resolved, and rejected if invalid,
 * before any pass runs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RewriteEngine implements HumanizerService {

    private final StyleProfileRegistry styleProfileRegistry;
    private final RewritePipeline rewritePipeline;
    private final Random randomSource;

    @Override
    public HumanizeResult humanize(String text, String style, RewriteOverrides overrides) {
        return humanize(text, style, overrides, randomSource);
    }

    @Override
    public HumanizeResult humanize(String text, String style, RewriteOverrides overrides, Random random) {
        RewriteConfiguration configuration = styleProfileRegistry.resolve(style, overrides);
        return rewritePipeline.execute(text, configuration, random);
    }
}
