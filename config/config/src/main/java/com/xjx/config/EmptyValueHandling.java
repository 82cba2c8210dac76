package com.xjx.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** What a JSON null becomes. */
public enum EmptyValueHandling {
    /** A Value node holding null. */
    NULL("null"),
    /** A Field node without a value. */
    UNDEFINED("undefined"),
    /** Dropped, together with any container left empty by the drop. */
    REMOVE("remove");

    private final String code;

    EmptyValueHandling(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static EmptyValueHandling fromCode(String code) {
        return Codes.fromCode(EmptyValueHandling.class, values(), code, EmptyValueHandling::code);
    }
}
