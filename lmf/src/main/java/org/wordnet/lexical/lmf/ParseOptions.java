package org.wordnet.lexical.lmf;

import java.util.function.DoubleConsumer;

import javax.annotation.Nullable;

import lombok.Builder;
import lombok.Value;

/**
 * Options shared by every parsing strategy.
 */
@Value
@Builder(toBuilder = true)
public class ParseOptions {
    private static final ParseOptions DEFAULTS = ParseOptions.builder().build();

    /** Fail on elements outside the WN-LMF vocabulary instead of skipping them. */
    @Builder.Default
    boolean strict = true;
    /**
     * Collapse runs of whitespace and trim definition, example and other text
     * content. Off by default: text is kept verbatim.
     */
    boolean normalizeText;
    /** Receives the fraction of the input consumed, from 0 to 1. */
    @Nullable
    DoubleConsumer progress;
    /** Size of the input in bytes when known, {@code -1} otherwise. */
    @Builder.Default
    long expectedSize = -1;
    /** Name used in logs and error messages. */
    @Builder.Default
    String sourceName = "<stream>";

    public static ParseOptions defaults() {
        return DEFAULTS;
    }
}
