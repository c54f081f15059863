package org.wordnet.lexical.lmf;

import java.util.Locale;

/**
 * The parsing strategies available. Selected by configuration, never guessed
 * from the input beyond {@link #AUTO}'s size threshold.
 */
public enum ParserStrategy {
    /** Pull parser over a stream, never holds the document. */
    STREAMING,
    /** Non-blocking push parser fed with byte chunks as they arrive. */
    ASYNC,
    /** Whole-document tree, for small inputs. */
    DOM,
    /** {@link #DOM} below a size threshold, {@link #STREAMING} above it. */
    AUTO;

    public static ParserStrategy fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown parser strategy: " + name, e);
        }
    }
}
