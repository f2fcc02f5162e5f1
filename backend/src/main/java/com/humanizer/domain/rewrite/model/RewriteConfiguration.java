package com.humanizer.domain.rewrite.model;

/**
 * Effective parameters for one rewrite call: the profile defaults merged with overrides.
 *
 * @param styleName the registry name the call asked for
 * @param profile   derived profile (never the registry instance when overrides were given)
 */
public record RewriteConfiguration(
        String styleName,
        StyleProfile profile
) {}
