package org.wordnet.lexical.common.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;

import org.junit.Test;
import org.wordnet.lexical.common.MapperUtils;
import org.wordnet.lexical.common.PartOfSpeech;
import org.wordnet.lexical.common.RelationType;

import com.fasterxml.jackson.databind.ObjectMapper;

public class SynsetUnitTest {
    private final ObjectMapper mapper = MapperUtils.getObjectMapper();

    @Test
    public void jsonKeepsOrderAndDefaults() throws IOException {
        Synset synset = Synset.builder()
                .id("ex-cat-n")
                .lexicon("ex")
                .partOfSpeech(PartOfSpeech.NOUN)
                .ili("i46593")
                .member("ex-cat-n-1")
                .member("ex-feline-n-1")
                .definition(new Definition("a small domesticated felid", "en", null))
                .relation(new Relation(RelationType.HYPERNYM, "ex-feline-n"))
                .build();

        String json = mapper.writeValueAsString(synset);
        assertThat(json).contains("\"partOfSpeech\":\"n\"", "\"type\":\"hypernym\"");
        assertThat(json).doesNotContain("iliDefinition");

        Synset read = mapper.readValue(json, Synset.class);
        assertThat(read).isEqualTo(synset);
        assertThat(read.getMembers()).containsExactly("ex-cat-n-1", "ex-feline-n-1");
        assertThat(read.isLexicalized()).isTrue();
    }

    @Test
    public void missingDefinitionIsEmpty() {
        Synset synset = Synset.builder().id("ex-1").lexicon("ex").partOfSpeech(PartOfSpeech.VERB).build();
        assertThat(synset.getDefinition()).isEmpty();
        assertThat(synset.hasIli()).isFalse();
        assertThat(synset.toBuilder().ili("in").build().hasIli()).isFalse();
    }
}
