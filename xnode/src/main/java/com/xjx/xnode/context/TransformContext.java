package com.xjx.xnode.context;

import com.xjx.common.Paths;
import com.xjx.config.XjxConfig;
import com.xjx.xnode.XNode;
import com.xjx.xnode.XNodeType;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Where the pipeline currently is: one context per visited node or attribute, linked to the
 * context of the enclosing node. The chain mirrors the tree but does not reference children.
 *
 * @param format        target format of the running conversion
 * @param path          dot path from the root; for an attribute, the owner's path plus the attribute name
 * @param attribute     true when this context describes an attribute
 * @param attributeName the attribute name, null for node contexts
 * @param parent        context of the enclosing node, null at the root
 */
public record TransformContext(
        Format format,
        String nodeName,
        XNodeType nodeType,
        String ns,
        String label,
        String path,
        boolean attribute,
        String attributeName,
        TransformContext parent,
        XjxConfig config) {

    public TransformContext {
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(config, "config");
    }

    public static TransformContext root(XNode node, Format format, XjxConfig config) {
        return new TransformContext(format, node.name(), node.type(), node.ns(), node.label(),
                node.name(), false, null, null, config);
    }

    public TransformContext child(XNode node) {
        return new TransformContext(format, node.name(), node.type(), node.ns(), node.label(),
                Paths.append(path, node.name()), false, null, this, config);
    }

    public TransformContext attribute(XNode attribute) {
        return new TransformContext(format, attribute.name(), XNodeType.ATTRIBUTE, attribute.ns(), attribute.label(),
                Paths.append(path, attribute.name()), true, attribute.name(), this, config);
    }

    /** Context for a node that was replaced in place: same position, new description. */
    public TransformContext withNode(XNode node) {
        String parentPath = parent == null ? "" : parent.path;
        return new TransformContext(format, node.name(), node.type(), node.ns(), node.label(),
                Paths.append(parentPath, node.name()), attribute, attribute ? node.name() : null, parent, config);
    }

    public int depth() {
        int d = 0;
        for (TransformContext p = parent; p != null; p = p.parent) d++;
        return d;
    }

    /** Nearest enclosing context (this one excluded) that matches. */
    public Optional<TransformContext> ancestor(Predicate<TransformContext> predicate) {
        for (TransformContext p = parent; p != null; p = p.parent) if (predicate.test(p)) return Optional.of(p);
        return Optional.empty();
    }

    public boolean isRoot() {
        return parent == null;
    }

    @Override
    public String toString() {
        return "TransformContext(" + format + ", " + (attribute ? "@" : "") + path + ", " + nodeType + ")";
    }
}
