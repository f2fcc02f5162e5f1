package com.humanizer.domain.rewrite.model;

import java.util.Locale;

/**
 * Register preference applied when ranking synonym candidates.
 */
public enum SynonymFormality {
    FORMAL,
    CASUAL,
    NEUTRAL,
    VARIED;

    public static SynonymFormality fromKey(String key) {
        return valueOf(key.trim().toUpperCase(Locale.ROOT));
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
