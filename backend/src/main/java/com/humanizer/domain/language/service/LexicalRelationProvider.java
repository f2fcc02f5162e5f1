package com.humanizer.domain.language.service;

import com.humanizer.domain.language.model.PartOfSpeech;
import com.humanizer.domain.language.model.SynonymCandidate;

import java.util.List;

/**
 * Source of synonym sets keyed by lemma and part of speech.
 */
public interface LexicalRelationProvider {

    /**
     * @param lemma lower-case dictionary form
     * @param pos   ADJ, NOUN, VERB or ADV; other tags yield an empty list
     * @return candidates in no particular order, never null
     */
    List<SynonymCandidate> synonyms(String lemma, PartOfSpeech pos);
}
