package com.xjx.config;

import java.util.Objects;

/** Options for writing a node tree as XML. */
public record XmlOutputConfig(
        boolean prettyPrint,
        int indent,
        boolean declaration,
        String encoding,
        boolean preserveNamespaces,
        NamespacePrefixHandling namespacePrefixHandling,
        CollectionHandling collectionHandling) {

    public XmlOutputConfig {
        Objects.requireNonNull(namespacePrefixHandling, "namespacePrefixHandling");
        Objects.requireNonNull(collectionHandling, "collectionHandling");
        if (encoding == null || encoding.isBlank()) throw new IllegalArgumentException("encoding must be set");
        if (indent < 0) throw new IllegalArgumentException("indent must be >= 0, was " + indent);
    }

    public static XmlOutputConfig defaults() {
        return new XmlOutputConfig(true, 2, true, "UTF-8", true, NamespacePrefixHandling.PRESERVE,
                CollectionHandling.REPEAT);
    }

    public XmlOutputConfig withPrettyPrint(boolean pretty) {
        return new XmlOutputConfig(pretty, indent, declaration, encoding, preserveNamespaces, namespacePrefixHandling,
                collectionHandling);
    }

    public XmlOutputConfig withDeclaration(boolean decl) {
        return new XmlOutputConfig(prettyPrint, indent, decl, encoding, preserveNamespaces, namespacePrefixHandling,
                collectionHandling);
    }

    public XmlOutputConfig withCollectionHandling(CollectionHandling handling) {
        return new XmlOutputConfig(prettyPrint, indent, declaration, encoding, preserveNamespaces,
                namespacePrefixHandling, handling);
    }
}
