package com.humanizer.infrastructure.nlp;

import com.humanizer.domain.language.model.PartOfSpeech;
import com.humanizer.domain.language.model.SynonymCandidate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ThesaurusSynonymProviderTest {

    private final ThesaurusSynonymProvider provider = new ThesaurusSynonymProvider(ThesaurusSynonymProvider.DEFAULT_PATH);

    @Test
    @DisplayName("synonyms are looked up by lemma and part of speech")
    void lookup() {
        assertThat(provider.synonyms("important", PartOfSpeech.ADJ))
                .extracting(SynonymCandidate::word)
                .contains("significant", "crucial");
    }

    @Test
    @DisplayName("the part of speech selects the section")
    void wrong_section() {
        assertThat(provider.synonyms("important", PartOfSpeech.VERB)).isEmpty();
    }

    @Test
    @DisplayName("unknown lemmas and null arguments yield an empty list")
    void unknown_lemma() {
        assertThat(provider.synonyms("zyzzyva", PartOfSpeech.NOUN)).isEmpty();
        assertThat(provider.synonyms(null, PartOfSpeech.NOUN)).isEmpty();
        assertThat(provider.synonyms("important", null)).isEmpty();
    }

    @Test
    @DisplayName("missing resource → provider answers with nothing")
    void missing_resource() {
        ThesaurusSynonymProvider empty = new ThesaurusSynonymProvider("lexicon/does-not-exist.json");

        assertThat(empty.synonyms("important", PartOfSpeech.ADJ)).isEmpty();
    }
}
