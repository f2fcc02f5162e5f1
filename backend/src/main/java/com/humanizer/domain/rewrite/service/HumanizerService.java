package com.humanizer.domain.rewrite.service;

import com.humanizer.domain.rewrite.model.HumanizeResult;
import com.humanizer.domain.rewrite.model.RewriteOverrides;

import java.util.Random;

/**
 * Domain service interface for style-configurable prose rewriting.
 */
public interface HumanizerService {

    /**
     * Rewrite the text under the named style profile.
     *
     * @param text      the input prose (citations are preserved verbatim)
     * @param style     a registry style name, e.g. "academic"
     * @param overrides optional per-call overrides (nullable)
     * @return the rewrite result with word and sentence counts
     * @throws com.humanizer.domain.rewrite.exception.InvalidConfigurationException
     *         for an unknown style or an out-of-range override
     */
    HumanizeResult humanize(String text, String style, RewriteOverrides overrides);

    /**
     * Same as {@link #humanize(String, String, RewriteOverrides)} with a caller-supplied random source,
     * so a seeded source reproduces the same output.
     */
    HumanizeResult humanize(String text, String style, RewriteOverrides overrides, Random random);
}
