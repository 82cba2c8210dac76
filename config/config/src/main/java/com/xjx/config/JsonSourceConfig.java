package com.xjx.config;

import java.util.Map;
import java.util.Objects;

/**
 * Options for reading a JSON value into a node tree.
 *
 * @param arrayItemNames  item name per parent property, e.g. {@code items -> item}
 * @param defaultItemName item name for arrays without an entry in {@code arrayItemNames}
 * @param rootName        name of the root node when the JSON root is not a single-key object
 * @param attributePrefix key prefix marking attributes
 */
public record JsonSourceConfig(
        Map<String, String> arrayItemNames,
        String defaultItemName,
        FieldVsValue fieldVsValue,
        EmptyValueHandling emptyValueHandling,
        String rootName,
        String attributePrefix) {

    public JsonSourceConfig {
        arrayItemNames = arrayItemNames == null ? Map.of() : Map.copyOf(arrayItemNames);
        Objects.requireNonNull(fieldVsValue, "fieldVsValue");
        Objects.requireNonNull(emptyValueHandling, "emptyValueHandling");
        if (defaultItemName == null || defaultItemName.isBlank())
            throw new IllegalArgumentException("defaultItemName must be set");
        if (rootName == null || rootName.isBlank()) throw new IllegalArgumentException("rootName must be set");
        if (attributePrefix == null || attributePrefix.isEmpty())
            throw new IllegalArgumentException("attributePrefix must be set");
    }

    public static JsonSourceConfig defaults() {
        return new JsonSourceConfig(Map.of(), "item", FieldVsValue.AUTO, EmptyValueHandling.NULL, "root", "@");
    }

    public String itemNameFor(String parentProperty) {
        return arrayItemNames.getOrDefault(parentProperty, defaultItemName);
    }

    public JsonSourceConfig withFieldVsValue(FieldVsValue policy) {
        return new JsonSourceConfig(arrayItemNames, defaultItemName, policy, emptyValueHandling, rootName,
                attributePrefix);
    }

    public JsonSourceConfig withEmptyValueHandling(EmptyValueHandling handling) {
        return new JsonSourceConfig(arrayItemNames, defaultItemName, fieldVsValue, handling, rootName,
                attributePrefix);
    }

    public JsonSourceConfig withArrayItemNames(Map<String, String> names) {
        return new JsonSourceConfig(names, defaultItemName, fieldVsValue, emptyValueHandling, rootName,
                attributePrefix);
    }
}
