package org.wordnet.lexical.common.model;

import javax.annotation.Nullable;

import lombok.Value;

/**
 * Entry of the interlingual index. Not owned by any lexicon: removing
 * lexicons never removes ILI entries.
 */
@Value
public class IliEntry {
    String id;
    @Nullable
    String definition;
    IliStatus status;
}
