package org.wordnet.lexical.lmf;

import java.io.ByteArrayInputStream;
import java.io.CharConversionException;
import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.annotation.concurrent.ThreadSafe;
import javax.xml.stream.Location;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wordnet.lexical.common.exception.LmfParseException;

import com.google.common.io.CountingInputStream;

/**
 * Pull parser built on the JDK's StAX implementation. Holds nothing but the
 * current event, the input is read as the document is processed.
 */
@ThreadSafe
public class StaxLmfParser implements LmfParser {
    private static final Logger log = LoggerFactory.getLogger(StaxLmfParser.class);
    private static final Pattern SYSTEM_ID = Pattern.compile("SYSTEM\\s+[\"']([^\"']+)[\"']");

    private final XMLInputFactory factory;

    public StaxLmfParser() {
        // The default implementation, not whichever StAX provider is on the classpath.
        factory = XMLInputFactory.newDefaultFactory();
        factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, Boolean.TRUE);
        factory.setProperty(XMLInputFactory.IS_COALESCING, Boolean.TRUE);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
        // The DOCTYPE is needed for the schema version but the DTD itself is never fetched.
        factory.setXMLResolver((publicId, systemId, baseUri, namespace) -> new ByteArrayInputStream(new byte[0]));
    }

    @Override
    public void parse(InputStream in, ParseOptions options, LmfHandler handler) throws IOException {
        CountingInputStream counting = new CountingInputStream(in);
        LmfEventProcessor processor = new LmfEventProcessor(options, handler, counting::getCount);
        XMLStreamReader reader;
        try {
            reader = factory.createXMLStreamReader(counting, "UTF-8");
        } catch (XMLStreamException e) {
            throw readFailure(processor, e);
        }
        try {
            while (reader.hasNext()) {
                int event = reader.next();
                Location location = reader.getLocation();
                processor.setLocation(location.getLineNumber(), location.getColumnNumber());
                switch (event) {
                    case XMLStreamConstants.DTD:
                        processor.doctype(systemId(reader.getText()));
                        break;
                    case XMLStreamConstants.START_ELEMENT:
                        processor.startElement(reader.getLocalName(), attributes(reader));
                        break;
                    case XMLStreamConstants.CHARACTERS:
                    case XMLStreamConstants.CDATA:
                    case XMLStreamConstants.SPACE:
                        processor.characters(reader.getTextCharacters(), reader.getTextStart(), reader.getTextLength());
                        break;
                    case XMLStreamConstants.END_ELEMENT:
                        processor.endElement(reader.getLocalName());
                        break;
                    default:
                        break;
                }
            }
            processor.endOfInput();
        } catch (XMLStreamException e) {
            throw readFailure(processor, e);
        } finally {
            closeQuietly(reader);
        }
    }

    /**
     * The JDK reader reports failures of the underlying stream as stream
     * exceptions, those are rethrown as they came. Bytes that do not decode
     * are a malformed document, not a read failure.
     */
    private static IOException readFailure(LmfEventProcessor processor, XMLStreamException e) throws IOException {
        if (e.getNestedException() instanceof CharConversionException) {
            throw malformed(processor, e);
        }
        if (e.getNestedException() instanceof IOException) {
            throw (IOException) e.getNestedException();
        }
        throw malformed(processor, e);
    }

    static String systemId(String doctype) {
        if (doctype == null) {
            return null;
        }
        Matcher matcher = SYSTEM_ID.matcher(doctype);
        return matcher.find() ? matcher.group(1) : null;
    }

    static Map<String, String> attributes(XMLStreamReader reader) {
        int count = reader.getAttributeCount();
        Map<String, String> attributes = new HashMap<>(count * 2);
        for (int i = 0; i < count; i++) {
            attributes.put(reader.getAttributeLocalName(i), reader.getAttributeValue(i));
        }
        return attributes;
    }

    static LmfParseException malformed(LmfEventProcessor processor, XMLStreamException e) {
        Location location = e.getLocation();
        int line = location == null ? -1 : location.getLineNumber();
        int column = location == null ? -1 : location.getColumnNumber();
        return processor.malformed(e.getMessage(), line, column, e);
    }

    private static void closeQuietly(XMLStreamReader reader) {
        try {
            reader.close();
        } catch (XMLStreamException e) {
            log.debug("Failed to close XML reader, the input stream is closed by the caller", e);
        }
    }
}
