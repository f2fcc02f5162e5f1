package com.humanizer.domain.rewrite.model;

/**
 * Coarse class of a sentence's grammatical subject, used by the hedging gates.
 */
public enum SubjectType {
    TECHNICAL,
    RESEARCH,
    GENERAL
}
