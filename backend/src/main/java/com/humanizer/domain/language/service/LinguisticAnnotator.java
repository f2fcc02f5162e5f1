package com.humanizer.domain.language.service;

import com.humanizer.domain.language.model.Annotation;

/**
 * Narrow seam to a linguistic annotation backend (part-of-speech tags, dependency roles,
 * lemmas, entities). Implementations must be safe for concurrent reads.
 */
public interface LinguisticAnnotator {

    /**
     * @return false when the backend's resources are not loaded; callers then skip
     *         annotation-dependent work instead of failing
     */
    boolean isAvailable();

    /**
     * Annotate a single sentence.
     *
     * @throws com.humanizer.domain.language.exception.AnnotationUnavailableException
     *         when {@link #isAvailable()} is false
     */
    Annotation annotate(String sentence);
}
