package org.wordnet.lexical.lmf;

/**
 * Creates the parser for a strategy.
 */
public final class LmfParsers {
    /** Default size under which {@link ParserStrategy#AUTO} builds a tree: 8MiB. */
    public static final long DEFAULT_DOM_THRESHOLD = 8L * 1024 * 1024;

    private LmfParsers() {
        // Utility class
    }

    public static LmfParser forStrategy(ParserStrategy strategy) {
        return forStrategy(strategy, DEFAULT_DOM_THRESHOLD);
    }

    public static LmfParser forStrategy(ParserStrategy strategy, long domThreshold) {
        switch (strategy) {
            case STREAMING:
                return new StaxLmfParser();
            case ASYNC:
                return new AsyncLmfParser();
            case DOM:
                return new DomLmfParser();
            case AUTO:
                return new AutoLmfParser(new DomLmfParser(), new StaxLmfParser(), domThreshold);
            default:
                throw new IllegalArgumentException("Unsupported strategy " + strategy);
        }
    }
}
