package org.wordnet.lexical.lmf;

import static java.nio.charset.StandardCharsets.ISO_8859_1;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;

import javax.annotation.concurrent.ThreadSafe;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.aalto.AsyncXMLInputFactory;
import com.fasterxml.aalto.stax.InputFactoryImpl;

/**
 * Non-blocking parser built on Aalto's asynchronous reader. Use
 * {@link #newFeeder(ParseOptions, LmfHandler)} to push bytes as they arrive;
 * {@link #parse(InputStream, ParseOptions, LmfHandler)} simply pumps a
 * stream through a feeder.
 *
 * <p>The feeder cannot expand entities declared in an internal DTD subset.
 * When the prolog of a stream carries one, the stream goes to a
 * {@link StaxLmfParser} instead.
 */
@ThreadSafe
public class AsyncLmfParser implements LmfParser {
    private static final Logger log = LoggerFactory.getLogger(AsyncLmfParser.class);
    private static final int CHUNK_SIZE = 64 * 1024;
    /** How far into a stream to look for the DOCTYPE. */
    private static final int PROLOG_LIMIT = 8 * 1024;

    private final AsyncXMLInputFactory factory;
    private final LmfParser internalSubsetFallback = new StaxLmfParser();

    public AsyncLmfParser() {
        factory = new InputFactoryImpl();
        factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, Boolean.TRUE);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
    }

    public AsyncLmfFeeder newFeeder(ParseOptions options, LmfHandler handler) {
        return new AsyncLmfFeeder(factory.createAsyncForByteArray(), options, handler);
    }

    @Override
    public void parse(InputStream in, ParseOptions options, LmfHandler handler) throws IOException {
        BufferedInputStream buffered = new BufferedInputStream(in, PROLOG_LIMIT);
        buffered.mark(PROLOG_LIMIT);
        byte[] prolog = buffered.readNBytes(PROLOG_LIMIT);
        buffered.reset();
        if (hasInternalSubset(prolog)) {
            log.debug("{} declares an internal DTD subset, parsing it with the streaming parser",
                    options.getSourceName());
            internalSubsetFallback.parse(buffered, options, handler);
            return;
        }
        pump(buffered, options, handler);
    }

    private void pump(InputStream in, ParseOptions options, LmfHandler handler) throws IOException {
        AsyncLmfFeeder feeder = newFeeder(options, handler);
        try {
            byte[] buffer = new byte[CHUNK_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                feeder.feed(buffer, 0, read);
            }
            feeder.endOfInput();
        } finally {
            try {
                feeder.close();
            } catch (XMLStreamException e) {
                log.debug("Failed to close async reader for {}", options.getSourceName(), e);
            }
        }
    }

    /**
     * Whether the DOCTYPE in the given prolog bytes opens an internal subset.
     * Only ASCII markup matters here, so the bytes are read as Latin-1.
     */
    static boolean hasInternalSubset(byte[] prolog) {
        String text = new String(prolog, ISO_8859_1);
        int start = text.indexOf("<!DOCTYPE");
        if (start < 0) {
            return false;
        }
        char quote = 0;
        for (int i = start + "<!DOCTYPE".length(); i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '[') {
                return true;
            } else if (c == '>') {
                return false;
            }
        }
        return false;
    }
}
