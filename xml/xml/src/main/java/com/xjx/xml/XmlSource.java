package com.xjx.xml;

import com.xjx.common.exceptions.XjxParseException;
import com.xjx.common.exceptions.XjxValidationException;
import com.xjx.config.AttributeHandling;
import com.xjx.config.NamespacePrefixHandling;
import com.xjx.config.XmlSourceConfig;
import com.xjx.xnode.XNode;
import com.xjx.xnode.XNodeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.w3c.dom.ProcessingInstruction;

import javax.xml.XMLConstants;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Reads a DOM into an {@link XNode} tree. Every element becomes a Record.
 * <ul>
 *     <li>text-only content becomes the Record's value</li>
 *     <li>element-only content becomes child Records</li>
 *     <li>mixed content keeps every text run, CDATA section, comment and processing instruction
 *     as its own child, in document order</li>
 * </ul>
 * Namespace declarations are never turned into nodes.
 */
public final class XmlSource {
    private static final Logger log = LoggerFactory.getLogger(XmlSource.class);

    /** Name prefix of the Field children created when attributes are read as fields. */
    public static final String ATTRIBUTE_MARKER = "@";

    private final DomTypeClass dom;
    private final XmlSourceConfig config;

    public XmlSource(DomTypeClass dom, XmlSourceConfig config) {
        this.dom = Objects.requireNonNull(dom, "dom");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * @throws XjxValidationException if the text is null or blank
     * @throws XjxParseException      if the text is not well-formed
     */
    public XNode fromXml(String xml) {
        if (xml == null || xml.isBlank()) throw new XjxValidationException("XML input must not be null or blank");
        log.debug("Parsing {} chars of XML", xml.length());
        return fromDocument(dom.parse(xml));
    }

    public XNode fromDocument(Document doc) {
        Element root = doc == null ? null : doc.getDocumentElement();
        if (root == null) throw new XjxValidationException("XML document has no root element");
        XNode node = element(root, new HashMap<>());
        log.debug("Read XML root <{}>", node.name());
        return node;
    }

    private XNode element(Element el, Map<String, String> inScope) {
        Map<String, String> scope = declarations(el, inScope);
        String prefix = prefixOf(el);
        XNode node = XNode.record(nameOf(prefix, localNameOf(el)));
        if (config.namespacePrefixHandling() == NamespacePrefixHandling.LABEL && prefix != null) node.setLabel(prefix);
        if (config.preserveNamespaces()) node.setNs(namespaceOf(el, prefix, scope, true));

        if (config.preserveAttributes()) readAttributes(el, node, scope);

        NodeList kids = el.getChildNodes();
        if (isTextOnly(kids)) {
            String text = collectText(kids);
            if (!config.preserveWhitespace()) text = text.trim();
            if (!text.isEmpty()) node.setValue(text);
            return node;
        }
        for (int i = 0; i < kids.getLength(); i++) {
            XNode child = child(kids.item(i), scope);
            if (child != null) node.addChild(child);
        }
        return node;
    }

    private XNode child(Node n, Map<String, String> scope) {
        switch (n.getNodeType()) {
            case Node.ELEMENT_NODE:
                return element((Element) n, scope);
            case Node.TEXT_NODE:
                return text(n.getNodeValue());
            case Node.CDATA_SECTION_NODE:
                return config.preserveCDATA() ? XNode.data(n.getNodeValue()) : null;
            case Node.COMMENT_NODE:
                return config.preserveComments() ? XNode.comment(n.getNodeValue()) : null;
            case Node.PROCESSING_INSTRUCTION_NODE:
                ProcessingInstruction pi = (ProcessingInstruction) n;
                return config.preserveInstructions() ? XNode.instruction(pi.getTarget(), pi.getData()) : null;
            case Node.ENTITY_REFERENCE_NODE:
                return text(n.getTextContent());
            default:
                log.warn("Skipping unsupported DOM node type {} ({})", n.getNodeType(), n.getNodeName());
                return null;
        }
    }

    /** Whitespace-only runs are dropped unless whitespace is preserved; other runs are kept verbatim. */
    private XNode text(String s) {
        if (!config.preserveTextNodes() || s == null) return null;
        if (!config.preserveWhitespace() && s.isBlank()) return null;
        return XNode.text(s);
    }

    private void readAttributes(Element el, XNode node, Map<String, String> scope) {
        NamedNodeMap attrs = el.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr a = (Attr) attrs.item(i);
            if (isNamespaceDeclaration(a)) continue;
            String prefix = prefixOf(a);
            String name = nameOf(prefix, localNameOf(a));
            String ns = config.preserveNamespaces() ? namespaceOf(a, prefix, scope, false) : null;
            String label = config.namespacePrefixHandling() == NamespacePrefixHandling.LABEL ? prefix : null;
            XNode attr = config.attributeHandling() == AttributeHandling.ATTRIBUTES
                    ? XNode.attribute(name, a.getValue())
                    : XNode.field(ATTRIBUTE_MARKER + name, a.getValue());
            attr.setNs(ns).setLabel(label);
            if (attr.type() == XNodeType.ATTRIBUTE) node.addAttribute(attr);
            else node.addChild(attr);
        }
    }

    private boolean isTextOnly(NodeList kids) {
        for (int i = 0; i < kids.getLength(); i++) {
            Node k = kids.item(i);
            switch (k.getNodeType()) {
                case Node.ELEMENT_NODE:
                    return false;
                case Node.CDATA_SECTION_NODE:
                    if (config.preserveCDATA()) return false;
                    break;
                case Node.COMMENT_NODE:
                    if (config.preserveComments()) return false;
                    break;
                case Node.PROCESSING_INSTRUCTION_NODE:
                    if (config.preserveInstructions()) return false;
                    break;
                default:
                    break;
            }
        }
        return true;
    }

    private static String collectText(NodeList kids) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < kids.getLength(); i++) {
            Node k = kids.item(i);
            short t = k.getNodeType();
            if (t == Node.TEXT_NODE || t == Node.CDATA_SECTION_NODE) sb.append(k.getNodeValue());
            else if (t == Node.ENTITY_REFERENCE_NODE) sb.append(k.getTextContent());
        }
        return sb.toString();
    }

    // ---------- names and namespaces ----------

    private String nameOf(String prefix, String local) {
        if (config.namespacePrefixHandling() == NamespacePrefixHandling.PRESERVE && prefix != null)
            return prefix + ":" + local;
        return local;
    }

    private static String prefixOf(Node n) {
        String p = n.getPrefix();
        if (p != null && !p.isEmpty()) return p;
        String qn = n.getNodeName();
        int colon = qn.indexOf(':');
        return colon > 0 ? qn.substring(0, colon) : null;
    }

    private static String localNameOf(Node n) {
        String local = n.getLocalName();
        if (local != null) return local;
        String qn = n.getNodeName();
        int colon = qn.indexOf(':');
        return colon > 0 ? qn.substring(colon + 1) : qn;
    }

    /** Falls back to the declarations in scope for DOMs built without namespace support. */
    private static String namespaceOf(Node n, String prefix, Map<String, String> scope, boolean element) {
        String uri = n.getNamespaceURI();
        if (uri != null && !uri.isEmpty()) return uri;
        if (prefix != null) return scope.get(prefix);
        // unprefixed attributes are in no namespace
        return element ? emptyToNull(scope.get("")) : null;
    }

    private static Map<String, String> declarations(Element el, Map<String, String> inScope) {
        NamedNodeMap attrs = el.getAttributes();
        Map<String, String> scope = inScope;
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr a = (Attr) attrs.item(i);
            if (!isNamespaceDeclaration(a)) continue;
            if (scope == inScope) scope = new HashMap<>(inScope);
            String qn = a.getName();
            scope.put(qn.equals(XMLConstants.XMLNS_ATTRIBUTE) ? "" : qn.substring(qn.indexOf(':') + 1), a.getValue());
        }
        return scope;
    }

    private static boolean isNamespaceDeclaration(Attr a) {
        String qn = a.getName();
        return XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(a.getNamespaceURI())
                || qn.equals(XMLConstants.XMLNS_ATTRIBUTE)
                || qn.startsWith(XMLConstants.XMLNS_ATTRIBUTE + ":");
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }
}
