package com.xjx.xnode;

import com.xjx.common.exceptions.XjxValidationException;

import java.util.Locale;

/** Kind of an {@link XNode}. The lower-case code is what high-fidelity JSON carries. */
public enum XNodeType {
    /** Keyed structure: an XML element or a JSON object. */
    RECORD("record"),
    /** Ordered repeated structure: a JSON array. */
    COLLECTION("collection"),
    FIELD("field"),
    VALUE("value"),
    ATTRIBUTE("attribute"),
    COMMENT("comment"),
    INSTRUCTION("instruction"),
    /** Character data kept apart from text, an XML CDATA section. */
    DATA("data");

    private final String code;

    XNodeType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static XNodeType fromCode(String code) {
        if (code != null) {
            String wanted = code.toLowerCase(Locale.ROOT);
            for (XNodeType t : values()) if (t.code.equals(wanted)) return t;
        }
        throw new XjxValidationException("Unknown node type '" + code + "'");
    }

    /** Field and Value carry a scalar and may, unusually, carry children as well. */
    public boolean isScalar() {
        return this == FIELD || this == VALUE;
    }

    public boolean isContainer() {
        return this == RECORD || this == COLLECTION;
    }
}
