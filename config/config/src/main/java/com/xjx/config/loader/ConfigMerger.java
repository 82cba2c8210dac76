package com.xjx.config.loader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Map;

/**
 * Deep merge of JSON trees. Object properties merge recursively; arrays and scalars
 * in the overlay replace the base. A JSON null in the overlay leaves the base value in place.
 */
public interface ConfigMerger {

    /** Returns a new tree; neither argument is modified. */
    static JsonNode merge(JsonNode base, JsonNode overlay) {
        if (overlay == null || overlay.isNull() || overlay.isMissingNode()) return base == null ? null : base.deepCopy();
        if (base == null || !base.isObject() || !overlay.isObject()) return overlay.deepCopy();
        ObjectNode result = ((ObjectNode) base).deepCopy();
        Iterator<Map.Entry<String, JsonNode>> it = overlay.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode existing = result.get(e.getKey());
            if (e.getValue().isNull()) continue;
            result.set(e.getKey(), merge(existing, e.getValue()));
        }
        return result;
    }
}
