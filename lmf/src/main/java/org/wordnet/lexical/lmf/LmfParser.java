package org.wordnet.lexical.lmf;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.wordnet.lexical.common.exception.LmfParseException;

/**
 * Parses WN-LMF documents. Implementations differ in how they read the XML
 * but all of them drive an {@link LmfEventProcessor}, so for the same input
 * they emit the same entities.
 */
public interface LmfParser {
    /**
     * Parse a document, sending entities to the handler as they complete.
     *
     * @throws LmfParseException on malformed XML or a schema violation
     * @throws IOException if reading the input fails
     */
    void parse(InputStream in, ParseOptions options, LmfHandler handler) throws IOException;

    /**
     * Parse a whole file into memory.
     */
    default LmfDocument parse(Path file, ParseOptions options) throws IOException {
        DocumentCollector collector = new DocumentCollector();
        parse(file, options, collector);
        return collector.getDocument();
    }

    default void parse(Path file, ParseOptions options, LmfHandler handler) throws IOException {
        ParseOptions sized = options.toBuilder()
                .expectedSize(Files.size(file))
                .sourceName(file.toString())
                .build();
        try (InputStream in = Files.newInputStream(file)) {
            parse(in, sized, handler);
        }
    }
}
