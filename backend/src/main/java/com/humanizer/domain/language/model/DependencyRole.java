package com.humanizer.domain.language.model;

/**
 * Coarse dependency labels. Only the roles the rewrite passes look at are distinguished.
 */
public enum DependencyRole {
    ROOT,
    NSUBJ,
    AUX,
    DOBJ,
    POBJ,
    PREP,
    AMOD,
    ACOMP,
    ADVMOD,
    DET,
    COMPOUND,
    CC,
    MARK,
    CCOMP,
    PUNCT,
    DEP
}
