package com.xjx.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind given to JSON primitives that sit under an object property.
 * {@link #AUTO} promotes primitives deeper than the first level below the root to fields.
 */
public enum FieldVsValue {
    AUTO("auto"),
    FIELD("field"),
    VALUE("value");

    private final String code;

    FieldVsValue(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static FieldVsValue fromCode(String code) {
        return Codes.fromCode(FieldVsValue.class, values(), code, FieldVsValue::code);
    }
}
