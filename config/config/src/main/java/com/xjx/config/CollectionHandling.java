package com.xjx.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** How a Collection below an element is written as XML. */
public enum CollectionHandling {
    /** Items become repeated sibling elements named after the collection. */
    REPEAT("repeat"),
    /** A wrapper element named after the collection holds the items. */
    WRAP("wrap");

    private final String code;

    CollectionHandling(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static CollectionHandling fromCode(String code) {
        return Codes.fromCode(CollectionHandling.class, values(), code, CollectionHandling::code);
    }
}
