package com.xjx.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Whether XML attributes become attribute nodes or {@code @name} field children. */
public enum AttributeHandling {
    ATTRIBUTES("attributes"),
    FIELDS("fields");

    private final String code;

    AttributeHandling(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static AttributeHandling fromCode(String code) {
        return Codes.fromCode(AttributeHandling.class, values(), code, AttributeHandling::code);
    }
}
