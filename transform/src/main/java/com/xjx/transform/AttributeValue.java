package com.xjx.transform;

/** What an attribute transformer sees and returns. */
public record AttributeValue(String name, Object value) {

    public AttributeValue withName(String name) {
        return new AttributeValue(name, value);
    }

    public AttributeValue withValue(Object value) {
        return new AttributeValue(name, value);
    }
}
