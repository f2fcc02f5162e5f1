package com.humanizer.domain.rewrite.model;

/**
 * How a candidate sentence relates to its predecessor.
 */
public enum SentenceRelationship {
    ADDITION,
    CONTRAST,
    CAUSE,
    UNSAFE,
    NONE;

    /**
     * Only ADDITION, CONTRAST and CAUSE may be bridged by a connector.
     */
    public boolean isSafe() {
        return switch (this) {
            case ADDITION, CONTRAST, CAUSE -> true;
            case UNSAFE, NONE -> false;
        };
    }
}
