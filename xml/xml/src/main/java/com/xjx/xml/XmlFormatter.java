package com.xjx.xml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.w3c.dom.ProcessingInstruction;

import javax.xml.XMLConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;

/**
 * Writes DOM trees through a StAX writer, which does all escaping. Indented output classifies
 * each element's content:
 * <ul>
 *     <li>empty: self-closing tag</li>
 *     <li>text-only and mixed: written inline, whitespace untouched</li>
 *     <li>structured: one child per line, indented one level deeper</li>
 * </ul>
 * No XML declaration is written.
 */
public final class XmlFormatter {
    private static final Logger log = LoggerFactory.getLogger(XmlFormatter.class);

    public enum Content {EMPTY, TEXT_ONLY, MIXED, STRUCTURED}

    private final XMLStreamWriter w;
    private final int indent;

    private XmlFormatter(XMLStreamWriter w, int indent) {
        this.w = w;
        this.indent = Math.max(0, indent);
    }

    /** Writes the node as it stands, without added whitespace. */
    public static void writeCompact(Node node, XMLStreamWriter w) throws XMLStreamException {
        XmlFormatter f = new XmlFormatter(w, 0);
        if (node.getNodeType() == Node.DOCUMENT_NODE) {
            NodeList kids = node.getChildNodes();
            for (int i = 0; i < kids.getLength(); i++) f.inline(kids.item(i));
        } else {
            f.inline(node);
        }
    }

    /** Writes the node with {@code indent} spaces per level of structured content. */
    public static void writeIndented(Node node, int indent, XMLStreamWriter w) throws XMLStreamException {
        XmlFormatter f = new XmlFormatter(w, indent);
        if (node.getNodeType() == Node.DOCUMENT_NODE) {
            NodeList kids = node.getChildNodes();
            boolean first = true;
            for (int i = 0; i < kids.getLength(); i++) {
                Node k = kids.item(i);
                if (k.getNodeType() == Node.DOCUMENT_TYPE_NODE || isBlankText(k)) continue;
                if (!first) f.newline(0);
                f.block(k, 0);
                first = false;
            }
        } else {
            f.block(node, 0);
        }
    }

    public static Content classify(Element el) {
        NodeList kids = el.getChildNodes();
        boolean markup = false;
        boolean anyText = false;
        boolean solidText = false;
        for (int i = 0; i < kids.getLength(); i++) {
            Node k = kids.item(i);
            switch (k.getNodeType()) {
                case Node.TEXT_NODE -> {
                    String v = k.getNodeValue();
                    if (!v.isEmpty()) anyText = true;
                    if (!v.isBlank()) solidText = true;
                }
                case Node.CDATA_SECTION_NODE, Node.ENTITY_REFERENCE_NODE -> {
                    anyText = true;
                    solidText = true;
                }
                default -> markup = true;
            }
        }
        if (markup) return solidText ? Content.MIXED : Content.STRUCTURED;
        return anyText ? Content.TEXT_ONLY : Content.EMPTY;
    }

    private void block(Node n, int depth) throws XMLStreamException {
        if (n.getNodeType() != Node.ELEMENT_NODE || classify((Element) n) != Content.STRUCTURED) {
            inline(n);
            return;
        }
        Element el = (Element) n;
        startElement(el, false);
        NodeList kids = el.getChildNodes();
        for (int i = 0; i < kids.getLength(); i++) {
            Node k = kids.item(i);
            if (isBlankText(k)) continue;
            newline(depth + 1);
            block(k, depth + 1);
        }
        newline(depth);
        w.writeEndElement();
    }

    private void inline(Node n) throws XMLStreamException {
        switch (n.getNodeType()) {
            case Node.ELEMENT_NODE -> {
                Element el = (Element) n;
                if (classify(el) == Content.EMPTY) {
                    startElement(el, true);
                    return;
                }
                startElement(el, false);
                NodeList kids = el.getChildNodes();
                for (int i = 0; i < kids.getLength(); i++) inline(kids.item(i));
                w.writeEndElement();
            }
            case Node.TEXT_NODE -> w.writeCharacters(n.getNodeValue());
            case Node.CDATA_SECTION_NODE -> w.writeCData(n.getNodeValue());
            case Node.COMMENT_NODE -> w.writeComment(n.getNodeValue());
            case Node.PROCESSING_INSTRUCTION_NODE -> {
                ProcessingInstruction pi = (ProcessingInstruction) n;
                if (pi.getData() == null || pi.getData().isEmpty()) w.writeProcessingInstruction(pi.getTarget());
                else w.writeProcessingInstruction(pi.getTarget(), pi.getData());
            }
            case Node.ENTITY_REFERENCE_NODE -> w.writeCharacters(n.getTextContent());
            default -> log.warn("Skipping DOM node type {} ({})", n.getNodeType(), n.getNodeName());
        }
    }

    /** Namespace declarations first, then attributes, each in DOM order. */
    private void startElement(Element el, boolean empty) throws XMLStreamException {
        String prefix = el.getPrefix() == null ? "" : el.getPrefix();
        String local = el.getLocalName() == null ? el.getNodeName() : el.getLocalName();
        String ns = el.getNamespaceURI() == null ? "" : el.getNamespaceURI();
        if (empty) w.writeEmptyElement(prefix, local, ns);
        else w.writeStartElement(prefix, local, ns);

        NamedNodeMap attrs = el.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr a = (Attr) attrs.item(i);
            if (!XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(a.getNamespaceURI())) continue;
            if (XMLConstants.XMLNS_ATTRIBUTE.equals(a.getName())) w.writeDefaultNamespace(a.getValue());
            else w.writeNamespace(a.getLocalName(), a.getValue());
        }
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr a = (Attr) attrs.item(i);
            if (XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(a.getNamespaceURI())) continue;
            String aLocal = a.getLocalName() == null ? a.getName() : a.getLocalName();
            if (a.getNamespaceURI() == null) w.writeAttribute(aLocal, a.getValue());
            else w.writeAttribute(a.getPrefix() == null ? "" : a.getPrefix(), a.getNamespaceURI(), aLocal, a.getValue());
        }
    }

    private void newline(int depth) throws XMLStreamException {
        w.writeCharacters("\n" + " ".repeat(depth * indent));
    }

    private static boolean isBlankText(Node n) {
        return n.getNodeType() == Node.TEXT_NODE && n.getNodeValue().isBlank();
    }
}
