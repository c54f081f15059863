package org.wordnet.lexical.common.model;

import java.util.List;
import java.util.Optional;

import javax.annotation.Nullable;

import org.wordnet.lexical.common.PartOfSpeech;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A concept: the set of senses sharing one meaning, within one lexicon.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Synset {
    String id;
    String lexicon;
    PartOfSpeech partOfSpeech;
    /** Interlingual index id, absent when the synset isn't linked. */
    @Nullable
    String ili;
    /** Definition proposed for a new ILI entry ({@code ili="in"}). */
    @Nullable
    String iliDefinition;
    /** Member sense ids, in declared order. */
    @Singular
    List<String> members;
    @Singular
    List<Definition> definitions;
    @Singular
    List<Example> examples;
    @Singular
    List<Relation> relations;
    @Nullable
    String lexfile;
    @Builder.Default
    boolean lexicalized = true;

    /**
     * The first definition, if there is one.
     */
    @JsonIgnore
    public Optional<String> getDefinition() {
        return definitions.isEmpty() ? Optional.empty() : Optional.of(definitions.get(0).getText());
    }

    /**
     * Whether this synset refers to a real ILI entry. {@code in} marks a
     * proposed entry and isn't an id.
     */
    @JsonIgnore
    public boolean hasIli() {
        return ili != null && !ili.isEmpty() && !"in".equals(ili);
    }
}
