package com.xjx.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** How a namespace prefix travels between an XML name and a node. */
public enum NamespacePrefixHandling {
    /** Keep {@code p:name} as the node name. */
    PRESERVE("preserve"),
    /** Drop the prefix, keep only the local name. */
    STRIP("strip"),
    /** Local name as the node name, prefix stored in the node's label. */
    LABEL("label");

    private final String code;

    NamespacePrefixHandling(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static NamespacePrefixHandling fromCode(String code) {
        return Codes.fromCode(NamespacePrefixHandling.class, values(), code, NamespacePrefixHandling::code);
    }
}
