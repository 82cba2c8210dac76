package com.xjx.json;

/** Reserved JSON keys. */
public interface JsonMarkers {
    // high-fidelity shape
    String TYPE = "#type";
    String NAME = "#name";
    String VALUE = "#value";
    String ATTRIBUTES = "#attributes";
    String CHILDREN = "#children";
    String ID = "#id";
    String NS = "#ns";
    String LABEL = "#label";

    // standard shape
    String COMMENT = "#comment";
    String CDATA = "#cdata";
    String TEXT = "#text";
    String INSTRUCTION_PREFIX = "?";

    static boolean isMarker(String key) {
        return key.startsWith("#") || key.startsWith(INSTRUCTION_PREFIX);
    }
}
