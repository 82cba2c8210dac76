package com.xjx.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.xjx.common.exceptions.XjxProcessingException;
import com.xjx.config.JsonOutputConfig;
import com.xjx.xnode.XNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes an {@link XNode} tree as JSON, in the standard (lossy) or high-fidelity (lossless) shape.
 * See {@link JsonSource} for the shapes.
 */
public final class JsonOutput {
    private static final Logger log = LoggerFactory.getLogger(JsonOutput.class);
    private static final JsonNodeFactory NODES = Json.MAPPER.getNodeFactory();

    private final JsonOutputConfig config;

    public JsonOutput(JsonOutputConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    // ---------- standard ----------

    /** {@code { rootName: value }} */
    public ObjectNode toJson(XNode root) {
        Objects.requireNonNull(root, "root");
        ObjectNode out = NODES.objectNode();
        out.set(key(root), value(root));
        log.debug("Wrote standard JSON for {} '{}'", root.type().code(), root.name());
        return out;
    }

    public String toJsonString(XNode root) {
        return write(toJson(root));
    }

    private JsonNode value(XNode node) {
        return switch (node.type()) {
            case COLLECTION -> {
                ArrayNode array = NODES.arrayNode();
                for (XNode item : node.children()) array.add(value(item));
                yield array;
            }
            case RECORD -> object(node);
            case FIELD, VALUE -> node.hasChildren() || node.hasAttributes() ? object(node) : scalar(node);
            case ATTRIBUTE, COMMENT, INSTRUCTION, DATA -> scalar(node);
        };
    }

    private JsonNode object(XNode node) {
        ObjectNode obj = NODES.objectNode();
        for (XNode attr : node.attributes()) obj.set(config.attributePrefix() + attr.name(), scalar(attr));

        Map<String, List<XNode>> groups = new LinkedHashMap<>();
        for (XNode child : node.children()) groups.computeIfAbsent(key(child), k -> new ArrayList<>()).add(child);
        for (Map.Entry<String, List<XNode>> g : groups.entrySet()) {
            List<XNode> same = g.getValue();
            if (same.size() == 1) {
                obj.set(g.getKey(), value(same.get(0)));
            } else {
                ArrayNode array = obj.putArray(g.getKey());
                for (XNode child : same) array.add(value(child));
            }
        }

        if (obj.isEmpty()) return node.hasValue() ? scalar(node) : obj;
        if (node.hasValue() && node.value() != null) obj.set(JsonMarkers.VALUE, scalar(node));
        return obj;
    }

    private String key(XNode node) {
        return switch (node.type()) {
            case COMMENT -> JsonMarkers.COMMENT;
            case DATA -> JsonMarkers.CDATA;
            case INSTRUCTION -> JsonMarkers.INSTRUCTION_PREFIX + node.name();
            case ATTRIBUTE -> config.attributePrefix() + node.name();
            default -> node.name();
        };
    }

    // ---------- high fidelity ----------

    public ObjectNode toHiFi(XNode root) {
        Objects.requireNonNull(root, "root");
        ObjectNode out = hiFi(root);
        log.debug("Wrote high-fidelity JSON for {} '{}'", root.type().code(), root.name());
        return out;
    }

    public String toHiFiString(XNode root) {
        return write(toHiFi(root));
    }

    private ObjectNode hiFi(XNode node) {
        ObjectNode obj = NODES.objectNode();
        obj.put(JsonMarkers.TYPE, node.type().code());
        obj.put(JsonMarkers.NAME, node.name());
        if (node.id() != null) obj.put(JsonMarkers.ID, node.id());
        if (node.ns() != null) obj.put(JsonMarkers.NS, node.ns());
        if (node.label() != null) obj.put(JsonMarkers.LABEL, node.label());
        if (node.hasValue()) obj.set(JsonMarkers.VALUE, scalar(node));
        if (node.hasAttributes()) {
            ArrayNode attrs = obj.putArray(JsonMarkers.ATTRIBUTES);
            for (XNode attr : node.attributes()) attrs.add(hiFi(attr));
        }
        if (node.hasChildren()) {
            ArrayNode children = obj.putArray(JsonMarkers.CHILDREN);
            for (XNode child : node.children()) children.add(hiFi(child));
        }
        return obj;
    }

    // ---------- helpers ----------

    public String write(JsonNode json) {
        return Json.write(json, config.prettyPrint(), config.indent());
    }

    private static JsonNode scalar(XNode node) {
        Object v = node.value();
        if (v == null) return NODES.nullNode();
        if (v instanceof String s) return NODES.textNode(s);
        if (v instanceof Boolean b) return NODES.booleanNode(b);
        if (v instanceof Integer i) return NODES.numberNode(i);
        if (v instanceof Long l) return NODES.numberNode(l);
        if (v instanceof Short s) return NODES.numberNode(s);
        if (v instanceof Byte b) return NODES.numberNode(b);
        if (v instanceof BigInteger bi) return NODES.numberNode(bi);
        if (v instanceof BigDecimal bd) return NODES.numberNode(bd);
        if (v instanceof Double d) return NODES.numberNode(d);
        if (v instanceof Float f) return NODES.numberNode(f);
        if (v instanceof Number n) return NODES.numberNode(new BigDecimal(n.toString()));
        throw new XjxProcessingException("Cannot write value of type " + v.getClass().getName() + " at '" + node.path() + "'");
    }
}
