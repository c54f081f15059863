package org.wordnet.lexical.common.model;

import javax.annotation.Nullable;

import lombok.Value;

@Value
public class Example {
    String text;
    @Nullable
    String language;
}
