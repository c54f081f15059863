package org.wordnet.lexical.common.model;

import javax.annotation.Nullable;

import lombok.Value;

@Value
public class Definition {
    String text;
    @Nullable
    String language;
    /** Id of the sense this definition was written for, if any. */
    @Nullable
    String sourceSense;
}
