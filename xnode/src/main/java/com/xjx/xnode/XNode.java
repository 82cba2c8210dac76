package com.xjx.xnode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * One node of the semantic tree shared by the XML and JSON codecs.
 * <p>
 * A node owns its attributes and children exclusively: adding a node that already has a parent
 * moves it. {@code parent} is a back-reference only; it never takes part in equality, hashing or
 * printing, and the path is rebuilt from it on every call.
 * <p>
 * A value may be absent (containers) or present and null; {@link #hasValue()} tells the two apart.
 * Scalars are {@link String}, {@link Number} or {@link Boolean}.
 * <p>
 * Not thread safe. Use {@link #cloneDeep()} to let two callers work from the same tree.
 */
public final class XNode {
    public static final String TEXT = "#text";
    public static final String CDATA = "#cdata";
    public static final String COMMENT = "#comment";

    private final XNodeType type;
    private String name;
    private Object value;
    private boolean hasValue;
    private String ns;
    private String label;
    private String id;
    private final List<XNode> attributes = new ArrayList<>();
    private final List<XNode> children = new ArrayList<>();
    private XNode parent;

    private XNode(XNodeType type, String name) {
        this.type = Objects.requireNonNull(type, "type");
        this.name = Objects.requireNonNull(name, "name");
    }

    // --- Construction ---

    public static XNode of(XNodeType type, String name) {
        return new XNode(type, name);
    }

    public static XNode of(XNodeType type, String name, Object value) {
        return new XNode(type, name).setValue(value);
    }

    public static XNode record(String name) {
        return new XNode(XNodeType.RECORD, name);
    }

    public static XNode collection(String name) {
        return new XNode(XNodeType.COLLECTION, name);
    }

    public static XNode field(String name, Object value) {
        return of(XNodeType.FIELD, name, value);
    }

    /** A field without a value. */
    public static XNode field(String name) {
        return new XNode(XNodeType.FIELD, name);
    }

    public static XNode value(String name, Object value) {
        return of(XNodeType.VALUE, name, value);
    }

    public static XNode text(String text) {
        return of(XNodeType.VALUE, TEXT, text);
    }

    public static XNode attribute(String name, Object value) {
        return of(XNodeType.ATTRIBUTE, name, value);
    }

    public static XNode comment(String text) {
        return of(XNodeType.COMMENT, COMMENT, text);
    }

    /** @param target the processing-instruction target, used as the node name */
    public static XNode instruction(String target, String data) {
        return of(XNodeType.INSTRUCTION, target, data);
    }

    public static XNode data(String text) {
        return of(XNodeType.DATA, CDATA, text);
    }

    // --- Accessors ---

    public XNodeType type() {
        return type;
    }

    public String name() {
        return name;
    }

    public XNode setName(String name) {
        this.name = Objects.requireNonNull(name, "name");
        return this;
    }

    public boolean hasValue() {
        return hasValue;
    }

    /** The scalar value, or null when absent or explicitly null. */
    public Object value() {
        return value;
    }

    public XNode setValue(Object value) {
        if (value != null && !(value instanceof String) && !(value instanceof Number) && !(value instanceof Boolean))
            throw new IllegalArgumentException("Node values must be String, Number or Boolean, was " + value.getClass().getName());
        this.value = value;
        this.hasValue = true;
        return this;
    }

    public XNode clearValue() {
        this.value = null;
        this.hasValue = false;
        return this;
    }

    public String ns() {
        return ns;
    }

    public XNode setNs(String ns) {
        this.ns = ns;
        return this;
    }

    public String label() {
        return label;
    }

    public XNode setLabel(String label) {
        this.label = label;
        return this;
    }

    public String id() {
        return id;
    }

    public XNode setId(String id) {
        this.id = id;
        return this;
    }

    public XNode parent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == null;
    }

    public List<XNode> attributes() {
        return Collections.unmodifiableList(attributes);
    }

    public List<XNode> children() {
        return Collections.unmodifiableList(children);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public boolean hasAttributes() {
        return !attributes.isEmpty();
    }

    // --- Mutation ---

    public XNode addChild(XNode child) {
        adopt(child);
        children.add(child);
        return this;
    }

    public XNode addChild(int index, XNode child) {
        adopt(child);
        children.add(index, child);
        return this;
    }

    /** Adds an attribute node, replacing an existing attribute with the same name. */
    public XNode addAttribute(XNode attribute) {
        if (attribute.type != XNodeType.ATTRIBUTE)
            throw new IllegalArgumentException("Not an attribute node: " + attribute.type);
        adopt(attribute);
        for (int i = 0; i < attributes.size(); i++) {
            if (attributes.get(i).name.equals(attribute.name)) {
                attributes.get(i).parent = null;
                attributes.set(i, attribute);
                return this;
            }
        }
        attributes.add(attribute);
        return this;
    }

    public XNode setAttribute(String name, Object value) {
        return addAttribute(attribute(name, value));
    }

    public boolean removeChild(XNode child) {
        boolean removed = children.removeIf(c -> c == child);
        if (removed) child.parent = null;
        return removed;
    }

    public boolean removeAttribute(String name) {
        for (int i = 0; i < attributes.size(); i++) {
            if (attributes.get(i).name.equals(name)) {
                attributes.remove(i).parent = null;
                return true;
            }
        }
        return false;
    }

    /** Replaces all children; the new list is adopted in order. */
    public XNode replaceChildren(List<XNode> newChildren) {
        List<XNode> copy = new ArrayList<>(newChildren);
        for (XNode c : children) c.parent = null;
        children.clear();
        copy.forEach(this::addChild);
        return this;
    }

    public XNode replaceAttributes(List<XNode> newAttributes) {
        List<XNode> copy = new ArrayList<>(newAttributes);
        for (XNode a : attributes) a.parent = null;
        attributes.clear();
        copy.forEach(this::addAttribute);
        return this;
    }

    /** Puts {@code replacement} where this node sits under its parent. */
    public void replaceWith(XNode replacement) {
        if (replacement == this) return;
        XNode p = parent;
        if (p == null) throw new IllegalStateException("Cannot replace a root node in place");
        List<XNode> list = type == XNodeType.ATTRIBUTE ? p.attributes : p.children;
        int index = indexOf(list, this);
        replacement.detach();
        list.set(index, replacement);
        replacement.parent = p;
        parent = null;
    }

    /** Removes this node from its parent, if any. */
    public XNode detach() {
        if (parent != null) {
            if (type == XNodeType.ATTRIBUTE) parent.attributes.removeIf(a -> a == this);
            else parent.children.removeIf(c -> c == this);
            parent = null;
        }
        return this;
    }

    private void adopt(XNode node) {
        if (node == this) throw new IllegalArgumentException("A node cannot contain itself");
        for (XNode p = parent; p != null; p = p.parent)
            if (p == node) throw new IllegalArgumentException("A node cannot contain its ancestor " + node.name);
        node.detach();
        node.parent = this;
    }

    private static int indexOf(List<XNode> list, XNode node) {
        for (int i = 0; i < list.size(); i++) if (list.get(i) == node) return i;
        throw new IllegalStateException("Node " + node.name + " not found under its parent");
    }

    // --- Queries ---

    public Optional<XNode> findChild(String name) {
        return children.stream().filter(c -> c.name.equals(name)).findFirst();
    }

    public List<XNode> findChildren(String name) {
        return children.stream().filter(c -> c.name.equals(name)).toList();
    }

    public Optional<XNode> findAttribute(String name) {
        return attributes.stream().filter(a -> a.name.equals(name)).findFirst();
    }

    /** Depth-first, pre-order, this node included. */
    public Optional<XNode> findDeep(Predicate<XNode> predicate) {
        if (predicate.test(this)) return Optional.of(this);
        for (XNode c : children) {
            Optional<XNode> found = c.findDeep(predicate);
            if (found.isPresent()) return found;
        }
        return Optional.empty();
    }

    /** Every match, depth-first pre-order, this node included. */
    public List<XNode> findAll(Predicate<XNode> predicate) {
        List<XNode> out = new ArrayList<>();
        collect(predicate, out);
        return out;
    }

    private void collect(Predicate<XNode> predicate, List<XNode> out) {
        if (predicate.test(this)) out.add(this);
        for (XNode c : children) c.collect(predicate, out);
    }

    /** Own value plus the values of all descendant Value, Field and Data nodes, in document order. */
    public String textContent() {
        StringBuilder sb = new StringBuilder();
        appendText(sb);
        return sb.toString();
    }

    private void appendText(StringBuilder sb) {
        if (type == XNodeType.COMMENT || type == XNodeType.INSTRUCTION || type == XNodeType.ATTRIBUTE) return;
        if (hasValue && value != null) sb.append(value);
        for (XNode c : children) c.appendText(sb);
    }

    /** Dot-joined names from the root to this node. */
    public String path() {
        List<String> names = new ArrayList<>();
        for (XNode n = this; n != null; n = n.parent) names.add(n.name);
        Collections.reverse(names);
        return String.join(".", names);
    }

    public int depth() {
        int d = 0;
        for (XNode p = parent; p != null; p = p.parent) d++;
        return d;
    }

    // --- Cloning ---

    /** Copies this node and its attributes; children are not copied. The copy has no parent. */
    public XNode cloneShallow() {
        XNode copy = copyHeader();
        for (XNode a : attributes) copy.addAttribute(a.copyHeader());
        return copy;
    }

    /** Copies the whole subtree. The copy has no parent and shares nothing with this node. */
    public XNode cloneDeep() {
        XNode copy = cloneShallow();
        for (XNode c : children) copy.addChild(c.cloneDeep());
        return copy;
    }

    private XNode copyHeader() {
        XNode copy = new XNode(type, name);
        copy.value = value;
        copy.hasValue = hasValue;
        copy.ns = ns;
        copy.label = label;
        copy.id = id;
        return copy;
    }

    // --- Object ---

    /** Structural equality, see {@link XNodes#structurallyEqual(XNode, XNode)}. */
    @Override
    public boolean equals(Object o) {
        return o instanceof XNode other && XNodes.structurallyEqual(this, other);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name, XNodes.normalise(value), hasValue, ns, label, children);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(type.code()).append(':');
        if (label != null) sb.append(label).append(':');
        sb.append(name);
        if (hasValue) sb.append('=').append(value instanceof String ? "\"" + value + "\"" : value);
        if (!attributes.isEmpty()) sb.append(attributes);
        if (!children.isEmpty()) sb.append(children);
        return sb.toString();
    }
}
