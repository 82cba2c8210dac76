package com.xjx.xml;

import com.xjx.common.exceptions.XjxProcessingException;
import com.xjx.config.CollectionHandling;
import com.xjx.config.NamespacePrefixHandling;
import com.xjx.config.XmlOutputConfig;
import com.xjx.xnode.XNode;
import com.xjx.xnode.XNodeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.DOMException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.XMLConstants;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Writes an {@link XNode} tree as a DOM or as XML text.
 * <p>
 * Records, Fields and Values become elements; Comments, Instructions and Data become comment,
 * processing-instruction and CDATA nodes. Fields named {@code @x} and Attribute nodes become
 * attributes of the enclosing element. Children named {@code #text}, {@code #cdata} and
 * {@code #comment} become text, CDATA and comment nodes.
 * <p>
 * Namespace declarations are added on the first element where a binding enters scope.
 */
public final class XmlOutput {
    private static final Logger log = LoggerFactory.getLogger(XmlOutput.class);

    private final DomTypeClass dom;
    private final XmlOutputConfig config;

    public XmlOutput(DomTypeClass dom, XmlOutputConfig config) {
        this.dom = Objects.requireNonNull(dom, "dom");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * @throws XjxProcessingException if the tree cannot be written as well-formed XML
     */
    public Document toDocument(XNode root) {
        Objects.requireNonNull(root, "root");
        if (!isElementKind(root.type()) || isMarker(root.name()))
            throw new XjxProcessingException("Root node must become an element, was " + root.type().code() + " '" + root.name() + "'");
        Document doc = dom.newDocument();
        try {
            doc.appendChild(element(doc, root, root.name(), new HashMap<>()));
        } catch (DOMException e) {
            throw new XjxProcessingException("Cannot build XML for '" + root.name() + "': " + e.getMessage(), e);
        }
        return doc;
    }

    public String toXmlString(XNode root) {
        Document doc = toDocument(root);
        String body = config.prettyPrint() ? dom.serialize(doc, config.indent()) : dom.serialize(doc);
        log.debug("Wrote XML root <{}>, {} chars", root.name(), body.length());
        if (!config.declaration()) return body;
        return declaration() + (config.prettyPrint() ? "\n" : "") + body;
    }

    public String declaration() {
        return "<?xml version=\"1.0\" encoding=\"" + config.encoding() + "\"?>";
    }

    // ---------- tree walk ----------

    private Element element(Document doc, XNode node, String name, Map<String, String> inScope) {
        Map<String, String> scope = new HashMap<>(inScope);
        QName qn = qualify(name, node.label(), node.ns(), scope);
        Element el = dom.createElement(doc, qn.ns, qn.qualified());
        declare(el, qn, scope);

        for (XNode attr : node.attributes()) attribute(el, attr.name(), attr, scope);

        if (node.hasValue() && node.value() != null) el.appendChild(dom.createText(doc, text(node.value(), name)));

        if (node.type() == XNodeType.COLLECTION) {
            for (XNode item : node.children()) appendChild(doc, el, item, item.name(), scope);
        } else {
            for (XNode child : node.children()) {
                if (child.type() == XNodeType.COLLECTION && config.collectionHandling() == CollectionHandling.REPEAT) {
                    for (XNode item : child.children()) appendChild(doc, el, item, child.name(), scope);
                } else {
                    appendChild(doc, el, child, child.name(), scope);
                }
            }
        }
        return el;
    }

    private void appendChild(Document doc, Element parent, XNode child, String name, Map<String, String> scope) {
        switch (child.type()) {
            case COMMENT -> parent.appendChild(dom.createComment(doc, XmlEscapes.checkComment(stringValue(child))));
            case INSTRUCTION -> parent.appendChild(dom.createInstruction(doc, child.name(),
                    XmlEscapes.checkInstruction(child.name(), stringValue(child))));
            case DATA -> parent.appendChild(dom.createCData(doc, XmlEscapes.checkCData(stringValue(child))));
            case ATTRIBUTE -> attribute(parent, child.name(), child, scope);
            default -> {
                if (child.name().startsWith(XmlSource.ATTRIBUTE_MARKER) && child.type() == XNodeType.FIELD && !child.hasChildren()) {
                    attribute(parent, child.name().substring(XmlSource.ATTRIBUTE_MARKER.length()), child, scope);
                } else if (isMarker(child.name()) && child.type().isScalar() && !child.hasChildren()) {
                    String s = stringValue(child);
                    switch (child.name()) {
                        case XNode.TEXT -> parent.appendChild(dom.createText(doc, XmlEscapes.checkChars(s, "text")));
                        case XNode.CDATA -> parent.appendChild(dom.createCData(doc, XmlEscapes.checkCData(s)));
                        default -> parent.appendChild(dom.createComment(doc, XmlEscapes.checkComment(s)));
                    }
                } else {
                    parent.appendChild(element(doc, child, name, scope));
                }
            }
        }
    }

    private void attribute(Element el, String name, XNode attr, Map<String, String> scope) {
        String value = attr.hasValue() && attr.value() != null ? text(attr.value(), name) : "";
        QName qn = qualify(name, attr.label(), attr.ns(), scope);
        if (qn.ns != null && qn.prefix == null) {
            // an attribute only takes a namespace through a prefix
            qn = new QName(prefixFor(qn.ns, scope), qn.local, qn.ns);
        }
        if (qn.prefix != null) declare(el, qn, scope);
        if (qn.ns == null) dom.setAttribute(el, qn.local, value);
        else dom.setAttribute(el, qn.ns, qn.qualified(), value);
    }

    // ---------- namespaces ----------

    private record QName(String prefix, String local, String ns) {
        String qualified() {
            return prefix == null ? local : prefix + ":" + local;
        }
    }

    private QName qualify(String name, String label, String ns, Map<String, String> scope) {
        int colon = name.indexOf(':');
        String namePrefix = colon > 0 ? name.substring(0, colon) : null;
        String local = colon > 0 ? name.substring(colon + 1) : name;
        String prefix = switch (config.namespacePrefixHandling()) {
            case PRESERVE -> namePrefix != null ? namePrefix : label;
            case LABEL -> label != null ? label : namePrefix;
            case STRIP -> null;
        };
        String uri = config.preserveNamespaces() ? emptyToNull(ns) : null;
        if (XMLConstants.XML_NS_PREFIX.equals(prefix)) return new QName(prefix, local, XMLConstants.XML_NS_URI);
        if (uri == null && prefix != null) {
            uri = scope.get(prefix);
            if (uri == null) prefix = null;
        }
        return new QName(prefix, local, uri);
    }

    /** Adds an xmlns declaration when the element's binding is not already in scope. */
    private void declare(Element el, QName qn, Map<String, String> scope) {
        if (XMLConstants.XML_NS_PREFIX.equals(qn.prefix)) return;
        String key = qn.prefix == null ? "" : qn.prefix;
        String bound = scope.get(key);
        if (qn.ns == null) {
            if (key.isEmpty() && bound != null && !bound.isEmpty()) {
                dom.setAttribute(el, XMLConstants.XMLNS_ATTRIBUTE_NS_URI, XMLConstants.XMLNS_ATTRIBUTE, "");
                scope.put("", "");
            }
            return;
        }
        if (qn.ns.equals(bound)) return;
        String attrName = key.isEmpty() ? XMLConstants.XMLNS_ATTRIBUTE : XMLConstants.XMLNS_ATTRIBUTE + ":" + key;
        dom.setAttribute(el, XMLConstants.XMLNS_ATTRIBUTE_NS_URI, attrName, qn.ns);
        scope.put(key, qn.ns);
    }

    private static String prefixFor(String uri, Map<String, String> scope) {
        for (Map.Entry<String, String> e : scope.entrySet())
            if (!e.getKey().isEmpty() && e.getValue().equals(uri)) return e.getKey();
        int i = 0;
        while (scope.containsKey("ns" + i)) i++;
        return "ns" + i;
    }

    // ---------- values ----------

    private static String stringValue(XNode node) {
        return node.hasValue() && node.value() != null ? text(node.value(), node.name()) : "";
    }

    private static String text(Object value, String where) {
        String s = value instanceof BigDecimal bd ? bd.toPlainString() : String.valueOf(value);
        return XmlEscapes.checkChars(s, "'" + where + "'");
    }

    private static boolean isElementKind(XNodeType type) {
        return type.isContainer() || type.isScalar();
    }

    private static boolean isMarker(String name) {
        return name.equals(XNode.TEXT) || name.equals(XNode.CDATA) || name.equals(XNode.COMMENT);
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }
}
