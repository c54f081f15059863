package org.wordnet.lexical.common.model;

import javax.annotation.Nullable;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class Pronunciation {
    String value;
    @Nullable
    String variety;
    @Nullable
    String notation;
    @Builder.Default
    boolean phonemic = true;
    @Nullable
    String audio;
}
