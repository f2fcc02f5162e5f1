package com.humanizer.infrastructure.rewrite.style;

import com.humanizer.domain.rewrite.exception.InvalidConfigurationException;
import com.humanizer.domain.rewrite.model.RewriteConfiguration;
import com.humanizer.domain.rewrite.model.RewriteOverrides;
import com.humanizer.domain.rewrite.model.StyleProfile;
import com.humanizer.infrastructure.rewrite.pass.TransitionCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static com.humanizer.domain.rewrite.model.SynonymFormality.*;

/**
 * The named style profiles. Built once; entries are never modified, per-call overrides produce a derived copy.
 */
@Slf4j
@Component
public class StyleProfileRegistry {

    public static final String DEFAULT_STYLE = "balanced";

    private final Map<String, StyleProfile> profiles = new LinkedHashMap<>();
    private final TransitionCatalog transitionCatalog;

    public StyleProfileRegistry(TransitionCatalog transitionCatalog) {
        this.transitionCatalog = transitionCatalog;

        //                             syn   trans hedge comb  formality transitions  expand add    imperf variation restructure
        register("academic", new StyleProfile(0.25, 0.30, 0.25, 0.20, FORMAL, "academic", true, false, false, 0.10, 0.15));
        register("formal", new StyleProfile(0.25, 0.25, 0.15, 0.20, FORMAL, "formal", true, false, false, 0.15, 0.15));
        register("casual", new StyleProfile(0.30, 0.25, 0.10, 0.40, CASUAL, "casual", false, true, true, 0.30, 0.20));
        register("technical", new StyleProfile(0.10, 0.15, 0.05, 0.15, NEUTRAL, "technical", true, false, false, 0.05, 0.05));
        register("creative", new StyleProfile(0.35, 0.30, 0.15, 0.35, VARIED, "creative", false, false, true, 0.35, 0.30));
        register(DEFAULT_STYLE, new StyleProfile(0.20, 0.20, 0.15, 0.30, NEUTRAL, "balanced", true, false, false, 0.20, 0.15));
    }

    private void register(String name, StyleProfile profile) {
        if (!transitionCatalog.hasStyle(profile.transitionStyle())) {
            throw new IllegalStateException("Profile " + name + " names unknown transition style " + profile.transitionStyle());
        }
        profiles.put(name, profile);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(profiles.keySet());
    }

    public Map<String, StyleProfile> all() {
        return Collections.unmodifiableMap(profiles);
    }

    /**
     * @throws InvalidConfigurationException for an unknown style
     */
    public StyleProfile get(String name) {
        StyleProfile profile = profiles.get(normalize(name));
        if (profile == null) {
            throw new InvalidConfigurationException("Unknown style: '" + name + "'. Available: " + profiles.keySet());
        }
        return profile;
    }

    /**
     * Merge the named profile with per-call overrides. A blank style means {@value #DEFAULT_STYLE}.
     *
     * @throws InvalidConfigurationException for an unknown style, a probability outside [0, 1],
     *                                       or an unknown transition style
     */
    public RewriteConfiguration resolve(String style, RewriteOverrides overrides) {
        String name = style == null || style.isBlank() ? DEFAULT_STYLE : normalize(style);
        StyleProfile base = get(name);
        if (overrides == null) {
            return new RewriteConfiguration(name, base);
        }

        requireProbability("synonymProbability", overrides.synonymProbability());
        requireProbability("transitionProbability", overrides.transitionProbability());
        requireProbability("hedgingProbability", overrides.hedgingProbability());
        requireProbability("sentenceCombineProbability", overrides.sentenceCombineProbability());
        requireProbability("styleVariation", overrides.styleVariation());
        requireProbability("sentenceRestructure", overrides.sentenceRestructure());
        if (overrides.transitionStyle() != null && !transitionCatalog.hasStyle(overrides.transitionStyle())) {
            throw new InvalidConfigurationException("Unknown transition style: '" + overrides.transitionStyle()
                    + "'. Available: " + transitionCatalog.styles());
        }

        StyleProfile effective = base.withOverrides(overrides);
        log.debug("[StyleRegistry] Resolved '{}' with overrides: {}", name, effective);
        return new RewriteConfiguration(name, effective);
    }

    private static void requireProbability(String field, Double value) {
        if (value == null) {
            return;
        }
        if (value.isNaN() || value < 0.0 || value > 1.0) {
            throw new InvalidConfigurationException(field + " must be within [0, 1], got " + value);
        }
    }

    private static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
