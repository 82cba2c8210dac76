package com.xjx.xml;

import com.xjx.common.exceptions.XjxParseException;
import com.xjx.common.exceptions.XjxProcessingException;
import org.w3c.dom.Attr;
import org.w3c.dom.CDATASection;
import org.w3c.dom.Comment;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.ProcessingInstruction;
import org.w3c.dom.Text;

import java.util.regex.Pattern;

/**
 * The DOM capability the XML codec needs: parse, serialize, and build namespace-aware nodes.
 * Implementations decide how documents are parsed and written; the construction helpers work
 * on any {@link Document}.
 */
public interface DomTypeClass {

    /** An {@code &} that does not start one of the predefined entities or a character reference. */
    Pattern STRAY_AMPERSAND = Pattern.compile("&(?!amp;|lt;|gt;|quot;|apos;|#\\d+;|#x[\\da-fA-F]+;)");

    /**
     * @throws XjxParseException if the text is not well-formed XML
     */
    Document parse(String xml);

    /**
     * Compact serialization, no XML declaration.
     *
     * @throws XjxProcessingException if the node cannot be written as well-formed XML
     */
    String serialize(Node node);

    /**
     * Indented serialization, no XML declaration, laid out as {@link XmlFormatter} describes.
     *
     * @throws XjxProcessingException if the node cannot be written as well-formed XML
     */
    String serialize(Node node, int indent);

    /** An empty, namespace-aware document. */
    Document newDocument();

    // ---------- construction helpers ----------

    default Element createElement(Document doc, String name) {
        return doc.createElementNS(null, name);
    }

    default Element createElement(Document doc, String namespaceUri, String qualifiedName) {
        return doc.createElementNS(namespaceUri, qualifiedName);
    }

    default Text createText(Document doc, String text) {
        return doc.createTextNode(text);
    }

    default CDATASection createCData(Document doc, String text) {
        return doc.createCDATASection(text);
    }

    default Comment createComment(Document doc, String text) {
        return doc.createComment(text);
    }

    default ProcessingInstruction createInstruction(Document doc, String target, String data) {
        return doc.createProcessingInstruction(target, data);
    }

    default Attr setAttribute(Element element, String name, String value) {
        element.setAttributeNS(null, name, value);
        return element.getAttributeNodeNS(null, name);
    }

    default Attr setAttribute(Element element, String namespaceUri, String qualifiedName, String value) {
        element.setAttributeNS(namespaceUri, qualifiedName, value);
        int colon = qualifiedName.indexOf(':');
        return element.getAttributeNodeNS(namespaceUri, colon < 0 ? qualifiedName : qualifiedName.substring(colon + 1));
    }

    /**
     * Escapes each {@code &} that would otherwise make the text malformed.
     * CDATA sections and comments are left as they are.
     */
    static String escapeStrayAmpersands(String xml) {
        if (xml.indexOf('&') < 0) return xml;
        StringBuilder out = new StringBuilder(xml.length() + 16);
        int i = 0;
        while (i < xml.length()) {
            int cdata = xml.indexOf("<![CDATA[", i);
            int comment = xml.indexOf("<!--", i);
            int start = cdata < 0 ? comment : comment < 0 ? cdata : Math.min(cdata, comment);
            if (start < 0) {
                out.append(STRAY_AMPERSAND.matcher(xml.substring(i)).replaceAll("&amp;"));
                break;
            }
            out.append(STRAY_AMPERSAND.matcher(xml.substring(i, start)).replaceAll("&amp;"));
            String close = start == cdata ? "]]>" : "-->";
            int end = xml.indexOf(close, start);
            end = end < 0 ? xml.length() : end + close.length();
            out.append(xml, start, end);
            i = end;
        }
        return out.toString();
    }
}
