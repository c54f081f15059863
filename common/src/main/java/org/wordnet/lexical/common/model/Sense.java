package org.wordnet.lexical.common.model;

import java.util.List;

import javax.annotation.Nullable;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Pairing of a word with a synset.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Sense {
    String id;
    String lexicon;
    /** Owning word id. */
    String word;
    /** Synset id. */
    String synset;
    /** 1-based position of this sense within its word. */
    int rank;
    @Nullable
    String adjposition;
    @Builder.Default
    boolean lexicalized = true;
    @Singular
    List<Relation> relations;
    @Singular
    List<Example> examples;
    @Singular
    List<Integer> counts;
}
