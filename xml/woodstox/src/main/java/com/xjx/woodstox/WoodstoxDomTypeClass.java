package com.xjx.woodstox;

import com.ctc.wstx.api.WstxOutputProperties;
import com.ctc.wstx.stax.WstxInputFactory;
import com.ctc.wstx.stax.WstxOutputFactory;
import com.xjx.common.exceptions.XjxParseException;
import com.xjx.common.exceptions.XjxProcessingException;
import com.xjx.xml.DomTypeClass;
import com.xjx.xml.XmlFormatter;
import org.codehaus.stax2.XMLInputFactory2;
import org.codehaus.stax2.XMLOutputFactory2;
import org.codehaus.stax2.XMLStreamReader2;
import org.codehaus.stax2.XMLStreamWriter2;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.Text;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Woodstox/StAX2 backed DOM provider:
 * • parses with a pull reader into a namespace-aware DOM (CDATA reported, no coalescing)
 * • serializes, compact or indented, with a writer that validates structure and content, so bad
 *   comments, CDATA or processing instructions fail instead of being written; carriage returns
 *   are written as character references so they survive a re-read
 * <p>
 * Thread-safe, using one factory and one document builder per thread.
 */
public final class WoodstoxDomTypeClass implements DomTypeClass {
    private static final Logger log = LoggerFactory.getLogger(WoodstoxDomTypeClass.class);

    private static final ThreadLocal<XMLInputFactory2> INPUT = ThreadLocal.withInitial(() -> {
        XMLInputFactory2 f = new WstxInputFactory();
        f.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
        f.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
        f.setProperty(XMLInputFactory.IS_COALESCING, Boolean.FALSE);
        f.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, Boolean.TRUE);
        f.setProperty(XMLInputFactory2.P_REPORT_CDATA, Boolean.TRUE);
        f.setXMLResolver((publicId, systemId, baseURI, ns) -> null);
        return f;
    });

    private static final ThreadLocal<XMLOutputFactory2> OUTPUT = ThreadLocal.withInitial(() -> {
        XMLOutputFactory2 f = new WstxOutputFactory();
        f.setProperty(XMLOutputFactory2.P_AUTOMATIC_EMPTY_ELEMENTS, Boolean.TRUE);
        f.setProperty(WstxOutputProperties.P_OUTPUT_VALIDATE_STRUCTURE, Boolean.TRUE);
        f.setProperty(WstxOutputProperties.P_OUTPUT_VALIDATE_CONTENT, Boolean.TRUE);
        f.setProperty(WstxOutputProperties.P_OUTPUT_FIX_CONTENT, Boolean.FALSE);
        f.setProperty(WstxOutputProperties.P_OUTPUT_ESCAPE_CR, Boolean.TRUE);
        return f;
    });

    private static final ThreadLocal<DocumentBuilder> BUILDER = ThreadLocal.withInitial(() -> {
        try {
            DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
            f.setNamespaceAware(true);
            return f.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("No namespace-aware DocumentBuilder available", e);
        }
    });

    // ---------- parse ----------

    @Override
    public Document parse(String xml) {
        if (xml == null) throw new XjxParseException("XML was null");
        Document doc = newDocument();
        XMLStreamReader2 r = null;
        try {
            r = (XMLStreamReader2) INPUT.get().createXMLStreamReader(new StringReader(DomTypeClass.escapeStrayAmpersands(xml)));
            Deque<Node> stack = new ArrayDeque<>();
            stack.push(doc);
            while (r.hasNext()) {
                int ev = r.next();
                Node top = stack.peek();
                switch (ev) {
                    case XMLStreamConstants.START_ELEMENT -> {
                        Element el = startElement(doc, r);
                        top.appendChild(el);
                        stack.push(el);
                    }
                    case XMLStreamConstants.END_ELEMENT -> stack.pop();
                    case XMLStreamConstants.CHARACTERS, XMLStreamConstants.SPACE -> {
                        if (top != doc) appendText(doc, top, r.getText());
                    }
                    case XMLStreamConstants.CDATA -> top.appendChild(doc.createCDATASection(r.getText()));
                    case XMLStreamConstants.COMMENT -> top.appendChild(doc.createComment(r.getText()));
                    case XMLStreamConstants.PROCESSING_INSTRUCTION ->
                            top.appendChild(doc.createProcessingInstruction(r.getPITarget(), r.getPIData() == null ? "" : r.getPIData()));
                    default -> { /* document boundaries, DTD */ }
                }
            }
            return doc;
        } catch (XMLStreamException e) {
            throw new XjxParseException("Malformed XML: " + e.getMessage(), e);
        } finally {
            close(r);
        }
    }

    private static Element startElement(Document doc, XMLStreamReader2 r) {
        Element el = doc.createElementNS(emptyToNull(r.getNamespaceURI()), qualified(r.getPrefix(), r.getLocalName()));
        for (int i = 0; i < r.getNamespaceCount(); i++) {
            String p = r.getNamespacePrefix(i);
            String name = p == null || p.isEmpty() ? XMLConstants.XMLNS_ATTRIBUTE : XMLConstants.XMLNS_ATTRIBUTE + ":" + p;
            el.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, name, r.getNamespaceURI(i) == null ? "" : r.getNamespaceURI(i));
        }
        for (int i = 0; i < r.getAttributeCount(); i++) {
            el.setAttributeNS(emptyToNull(r.getAttributeNamespace(i)),
                    qualified(r.getAttributePrefix(i), r.getAttributeLocalName(i)), r.getAttributeValue(i));
        }
        return el;
    }

    /** Adjacent text events become one text node. */
    private static void appendText(Document doc, Node parent, String text) {
        Node last = parent.getLastChild();
        if (last != null && last.getNodeType() == Node.TEXT_NODE) ((Text) last).appendData(text);
        else parent.appendChild(doc.createTextNode(text));
    }

    // ---------- serialize ----------

    @Override
    public String serialize(Node node) {
        return write(node, false, 0);
    }

    @Override
    public String serialize(Node node, int indent) {
        return write(node, true, indent);
    }

    private String write(Node node, boolean indented, int indent) {
        StringWriter sw = new StringWriter(256);
        XMLStreamWriter2 w = null;
        try {
            w = (XMLStreamWriter2) OUTPUT.get().createXMLStreamWriter(sw);
            if (indented) XmlFormatter.writeIndented(node, indent, w);
            else XmlFormatter.writeCompact(node, w);
            w.flush();
            return sw.toString();
        } catch (XMLStreamException e) {
            throw new XjxProcessingException("Cannot serialize XML: " + e.getMessage(), e);
        } finally {
            if (w != null) try {
                w.close();
            } catch (XMLStreamException e) {
                log.warn("Failed to close XML writer", e);
            }
        }
    }

    // ---------- construction ----------

    @Override
    public Document newDocument() {
        return BUILDER.get().newDocument();
    }

    // ---------- helpers ----------

    private static String qualified(String prefix, String local) {
        return prefix == null || prefix.isEmpty() ? local : prefix + ":" + local;
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }

    private static void close(XMLStreamReader2 r) {
        if (r == null) return;
        try {
            r.close();
        } catch (XMLStreamException e) {
            log.warn("Failed to close XML reader", e);
        }
    }
}
