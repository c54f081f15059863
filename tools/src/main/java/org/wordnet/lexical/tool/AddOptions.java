package org.wordnet.lexical.tool;

import java.util.function.DoubleConsumer;

import javax.annotation.Nullable;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class AddOptions {
    private static final AddOptions DEFAULTS = AddOptions.builder().build();

    /** Replace lexicons already installed under the same id. */
    boolean force;
    /** Receives the fraction of the sources parsed, from 0 to 1. */
    @Nullable
    DoubleConsumer progress;

    public static AddOptions defaults() {
        return DEFAULTS;
    }
}
