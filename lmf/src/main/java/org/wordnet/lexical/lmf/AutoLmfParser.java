package org.wordnet.lexical.lmf;

import java.io.IOException;
import java.io.InputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delegates to a tree parser when the input is known to be small and to a
 * streaming parser otherwise, including when the size is unknown.
 */
public class AutoLmfParser implements LmfParser {
    private static final Logger log = LoggerFactory.getLogger(AutoLmfParser.class);

    private final LmfParser small;
    private final LmfParser large;
    private final long threshold;

    public AutoLmfParser(LmfParser small, LmfParser large, long threshold) {
        this.small = small;
        this.large = large;
        this.threshold = threshold;
    }

    @Override
    public void parse(InputStream in, ParseOptions options, LmfHandler handler) throws IOException {
        LmfParser delegate = select(options.getExpectedSize());
        log.debug("Parsing {} ({} bytes) with {}", options.getSourceName(), options.getExpectedSize(),
                delegate.getClass().getSimpleName());
        delegate.parse(in, options, handler);
    }

    LmfParser select(long size) {
        return size >= 0 && size < threshold ? small : large;
    }
}
