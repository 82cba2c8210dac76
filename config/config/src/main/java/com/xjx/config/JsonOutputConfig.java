package com.xjx.config;

public record JsonOutputConfig(boolean prettyPrint, int indent, String attributePrefix) {
    public JsonOutputConfig {
        if (indent < 0) throw new IllegalArgumentException("indent must be >= 0, was " + indent);
        if (attributePrefix == null || attributePrefix.isEmpty())
            throw new IllegalArgumentException("attributePrefix must be set");
    }

    public static JsonOutputConfig defaults() {
        return new JsonOutputConfig(true, 2, "@");
    }

    public JsonOutputConfig withPrettyPrint(boolean pretty) {
        return new JsonOutputConfig(pretty, indent, attributePrefix);
    }
}
