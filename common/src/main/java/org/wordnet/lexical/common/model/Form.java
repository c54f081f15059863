package org.wordnet.lexical.common.model;

import java.util.List;

import javax.annotation.Nullable;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * An alternative written form of a word (inflection, spelling variant).
 */
@Value
@Builder
@Jacksonized
public class Form {
    @Nullable
    String id;
    String writtenForm;
    @Nullable
    String script;
    @Singular
    List<Tag> tags;
}
