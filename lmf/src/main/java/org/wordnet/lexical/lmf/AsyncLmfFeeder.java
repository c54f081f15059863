package org.wordnet.lexical.lmf;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import javax.annotation.concurrent.NotThreadSafe;
import javax.xml.stream.Location;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;

import org.codehaus.stax2.DTDInfo;
import org.wordnet.lexical.common.exception.LmfParseException;

import com.fasterxml.aalto.AsyncByteArrayFeeder;
import com.fasterxml.aalto.AsyncXMLStreamReader;
import com.fasterxml.aalto.UncheckedStreamException;

/**
 * Push side of the non-blocking parser: the caller hands over bytes as they
 * arrive, in chunks of any size, and entities reach the handler as soon as
 * the bytes completing them have been fed. Chunk boundaries may fall
 * anywhere, including inside a tag or a multi-byte character.
 *
 * <p>Each call to {@link #feed(byte[], int, int)} processes everything it
 * can before returning, so the caller is free to reuse its buffer.
 *
 * <p>A leading UTF-8 byte order mark is dropped. Documents with an internal
 * DTD subset are rejected as malformed, the underlying reader cannot expand
 * the entities they declare. {@link AsyncLmfParser#parse} hands those to the
 * streaming parser instead.
 */
@NotThreadSafe
public class AsyncLmfFeeder implements AutoCloseable {
    private static final byte[] BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    private final AsyncXMLStreamReader<AsyncByteArrayFeeder> reader;
    private final LmfEventProcessor processor;
    private long fed;
    private boolean inputEnded;
    private boolean documentEnded;
    /** Leading bytes held back until it is known whether they are a byte order mark. */
    private byte[] head = new byte[0];
    private boolean bomChecked;

    AsyncLmfFeeder(AsyncXMLStreamReader<AsyncByteArrayFeeder> reader, ParseOptions options, LmfHandler handler) {
        this.reader = reader;
        this.processor = new LmfEventProcessor(options, handler, this::bytesFed);
    }

    public void feed(byte[] data) {
        feed(data, 0, data.length);
    }

    public void feed(byte[] data, int offset, int length) {
        if (inputEnded) {
            throw new IllegalStateException("Input already ended");
        }
        if (length == 0) {
            return;
        }
        fed += length;
        if (bomChecked) {
            push(data, offset, length);
            return;
        }
        byte[] joined = Arrays.copyOf(head, head.length + length);
        System.arraycopy(data, offset, joined, head.length, length);
        if (joined.length < BOM.length && isBomPrefix(joined)) {
            head = joined;
            return;
        }
        bomChecked = true;
        head = null;
        int skip = isBomPrefix(joined) ? BOM.length : 0;
        push(joined, skip, joined.length - skip);
    }

    /**
     * Signal that no more bytes will come. Fails if the document is
     * incomplete.
     */
    public void endOfInput() {
        if (inputEnded) {
            return;
        }
        inputEnded = true;
        if (!bomChecked) {
            // Fewer bytes than a byte order mark, all of them matching it.
            bomChecked = true;
            if (head.length > 0) {
                push(head, 0, head.length);
            }
            head = null;
        }
        try {
            reader.getInputFeeder().endOfInput();
            drain();
        } catch (XMLStreamException e) {
            throw malformed(e);
        } catch (UncheckedStreamException e) {
            throw malformed(e);
        }
        processor.endOfInput();
    }

    public long bytesFed() {
        return fed;
    }

    private void push(byte[] data, int offset, int length) {
        if (length == 0) {
            return;
        }
        try {
            reader.getInputFeeder().feedInput(data, offset, length);
            drain();
        } catch (XMLStreamException e) {
            throw malformed(e);
        } catch (UncheckedStreamException e) {
            // Text is decoded lazily, so encoding errors can surface outside next().
            throw malformed(e);
        }
    }

    private static boolean isBomPrefix(byte[] bytes) {
        int length = Math.min(bytes.length, BOM.length);
        for (int i = 0; i < length; i++) {
            if (bytes[i] != BOM[i]) {
                return false;
            }
        }
        return true;
    }

    private void drain() throws XMLStreamException {
        while (!documentEnded) {
            int event = reader.next();
            if (event == AsyncXMLStreamReader.EVENT_INCOMPLETE) {
                return;
            }
            Location location = reader.getLocation();
            processor.setLocation(location.getLineNumber(), location.getColumnNumber());
            switch (event) {
                case XMLStreamConstants.DTD:
                    DTDInfo dtd = reader.getDTDInfo();
                    processor.doctype(dtd == null ? null : dtd.getDTDSystemId());
                    break;
                case XMLStreamConstants.START_ELEMENT:
                    processor.startElement(reader.getLocalName(), attributes());
                    break;
                case XMLStreamConstants.CHARACTERS:
                case XMLStreamConstants.CDATA:
                case XMLStreamConstants.SPACE:
                    processor.characters(reader.getTextCharacters(), reader.getTextStart(), reader.getTextLength());
                    break;
                case XMLStreamConstants.END_ELEMENT:
                    processor.endElement(reader.getLocalName());
                    break;
                case XMLStreamConstants.END_DOCUMENT:
                    documentEnded = true;
                    break;
                default:
                    break;
            }
        }
    }

    private Map<String, String> attributes() {
        int count = reader.getAttributeCount();
        Map<String, String> attributes = new HashMap<>(count * 2);
        for (int i = 0; i < count; i++) {
            attributes.put(reader.getAttributeLocalName(i), reader.getAttributeValue(i));
        }
        return attributes;
    }

    private LmfParseException malformed(XMLStreamException e) {
        return StaxLmfParser.malformed(processor, e);
    }

    private LmfParseException malformed(UncheckedStreamException e) {
        if (e.getCause() instanceof XMLStreamException) {
            return malformed((XMLStreamException) e.getCause());
        }
        Location location = reader.getLocation();
        return processor.malformed(e.getMessage(), location.getLineNumber(), location.getColumnNumber(), e);
    }

    @Override
    public void close() throws XMLStreamException {
        reader.close();
    }
}
