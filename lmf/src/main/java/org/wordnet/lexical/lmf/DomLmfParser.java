package org.wordnet.lexical.lmf;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;

import javax.annotation.concurrent.ThreadSafe;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.DocumentType;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import com.google.common.io.CountingInputStream;

/**
 * Loads the whole document into a DOM tree before walking it. Fastest for
 * small files, memory grows with the document so {@link ParserStrategy#AUTO}
 * only picks it below a size threshold.
 *
 * <p>Structural errors carry no line information since the tree does not
 * keep it, well-formedness errors do.
 */
@ThreadSafe
public class DomLmfParser implements LmfParser {
    private static final Logger log = LoggerFactory.getLogger(DomLmfParser.class);
    private static final String LOAD_EXTERNAL_DTD = "http://apache.org/xml/features/nonvalidating/load-external-dtd";

    private final DocumentBuilderFactory factory;

    public DomLmfParser() {
        factory = DocumentBuilderFactory.newDefaultInstance();
        factory.setNamespaceAware(true);
        factory.setCoalescing(true);
        factory.setValidating(false);
        factory.setExpandEntityReferences(true);
        try {
            factory.setFeature(LOAD_EXTERNAL_DTD, false);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("JDK DOM parser does not support the expected features", e);
        }
    }

    @Override
    public void parse(InputStream in, ParseOptions options, LmfHandler handler) throws IOException {
        CountingInputStream counting = new CountingInputStream(in);
        LmfEventProcessor processor = new LmfEventProcessor(options, handler, counting::getCount);
        Document document;
        try {
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new FailingErrorHandler(options.getSourceName()));
            document = builder.parse(counting);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("Unable to create a DOM parser", e);
        } catch (SAXParseException e) {
            throw processor.malformed(e.getMessage(), e.getLineNumber(), e.getColumnNumber(), e);
        } catch (SAXException e) {
            throw processor.malformed(e.getMessage(), -1, -1, e);
        }

        processor.setLocation(-1, -1);
        DocumentType doctype = document.getDoctype();
        processor.doctype(doctype == null ? null : doctype.getSystemId());
        walk(document.getDocumentElement(), processor);
        processor.endOfInput();
    }

    private void walk(Element element, LmfEventProcessor processor) {
        String name = localName(element);
        processor.startElement(name, attributes(element));
        for (Node child = element.getFirstChild(); child != null; child = child.getNextSibling()) {
            switch (child.getNodeType()) {
                case Node.ELEMENT_NODE:
                    walk((Element) child, processor);
                    break;
                case Node.TEXT_NODE:
                case Node.CDATA_SECTION_NODE:
                    processor.characters(child.getNodeValue());
                    break;
                default:
                    break;
            }
        }
        processor.endElement(name);
    }

    private static String localName(Node node) {
        String localName = node.getLocalName();
        return localName == null ? node.getNodeName() : localName;
    }

    private static Map<String, String> attributes(Element element) {
        NamedNodeMap nodes = element.getAttributes();
        Map<String, String> attributes = new HashMap<>(nodes.getLength() * 2);
        for (int i = 0; i < nodes.getLength(); i++) {
            Attr attr = (Attr) nodes.item(i);
            if (XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attr.getNamespaceURI())) {
                continue;
            }
            attributes.put(localName(attr), attr.getValue());
        }
        return attributes;
    }

    /**
     * The default handler prints to stderr before the exception surfaces.
     */
    private static final class FailingErrorHandler implements ErrorHandler {
        private final String source;

        FailingErrorHandler(String source) {
            this.source = source;
        }

        @Override
        public void warning(SAXParseException e) {
            log.warn("{} line {}: {}", source, e.getLineNumber(), e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    }
}
