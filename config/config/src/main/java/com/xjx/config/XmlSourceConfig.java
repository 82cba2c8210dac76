package com.xjx.config;

import java.util.Objects;

/** Options for reading an XML document into a node tree. */
public record XmlSourceConfig(
        boolean preserveNamespaces,
        NamespacePrefixHandling namespacePrefixHandling,
        boolean preserveCDATA,
        boolean preserveComments,
        boolean preserveInstructions,
        boolean preserveTextNodes,
        boolean preserveWhitespace,
        boolean preserveAttributes,
        AttributeHandling attributeHandling) {

    public XmlSourceConfig {
        Objects.requireNonNull(namespacePrefixHandling, "namespacePrefixHandling");
        Objects.requireNonNull(attributeHandling, "attributeHandling");
    }

    public static XmlSourceConfig defaults() {
        return new XmlSourceConfig(true, NamespacePrefixHandling.PRESERVE, true, true, true, true, false, true,
                AttributeHandling.ATTRIBUTES);
    }

    public XmlSourceConfig withNamespacePrefixHandling(NamespacePrefixHandling handling) {
        return new XmlSourceConfig(preserveNamespaces, handling, preserveCDATA, preserveComments, preserveInstructions,
                preserveTextNodes, preserveWhitespace, preserveAttributes, attributeHandling);
    }

    public XmlSourceConfig withAttributeHandling(AttributeHandling handling) {
        return new XmlSourceConfig(preserveNamespaces, namespacePrefixHandling, preserveCDATA, preserveComments,
                preserveInstructions, preserveTextNodes, preserveWhitespace, preserveAttributes, handling);
    }

    public XmlSourceConfig withPreserveWhitespace(boolean preserve) {
        return new XmlSourceConfig(preserveNamespaces, namespacePrefixHandling, preserveCDATA, preserveComments,
                preserveInstructions, preserveTextNodes, preserve, preserveAttributes, attributeHandling);
    }
}
