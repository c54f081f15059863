package org.wordnet.lexical.common.model;

import java.util.List;

import javax.annotation.Nullable;

import org.wordnet.lexical.common.PartOfSpeech;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A lexical entry: a lemma with a part of speech, owned by one lexicon.
 * The lemma is kept exactly as written in the source.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Word {
    String id;
    String lexicon;
    String lemma;
    PartOfSpeech partOfSpeech;
    @Nullable
    String script;
    @Singular
    List<Form> forms;
    @Singular
    List<Pronunciation> pronunciations;
    @Singular
    List<Tag> tags;
}
