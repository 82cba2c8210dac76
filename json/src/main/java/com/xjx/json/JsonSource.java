package com.xjx.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeType;
import com.xjx.common.exceptions.XjxParseException;
import com.xjx.common.exceptions.XjxValidationException;
import com.xjx.config.EmptyValueHandling;
import com.xjx.config.JsonSourceConfig;
import com.xjx.xnode.XNode;
import com.xjx.xnode.XNodeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads JSON into an {@link XNode} tree.
 * <p>
 * Standard shape: objects become Records, arrays Collections and primitives Values or Fields.
 * A root object with a single ordinary property is unwrapped into a root named by that key.
 * Inside objects, keys starting with the attribute prefix become Attribute nodes, {@code #value}
 * becomes the node's own value, and {@code #text}, {@code #cdata}, {@code #comment} and
 * {@code ?target} become text, CDATA, comment and processing-instruction nodes.
 * <p>
 * High-fidelity shape: every node is an object carrying {@code #type}, {@code #name} and
 * optionally {@code #value}, {@code #id}, {@code #ns}, {@code #label}, {@code #attributes},
 * {@code #children}.
 */
public final class JsonSource {
    private static final Logger log = LoggerFactory.getLogger(JsonSource.class);

    private final JsonSourceConfig config;

    public JsonSource(JsonSourceConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    // ---------- standard ----------

    /**
     * @throws XjxParseException      if the text is not well-formed JSON
     * @throws XjxValidationException if the text is null
     */
    public XNode fromJson(String json) {
        if (json == null) throw new XjxValidationException("JSON was null");
        return fromJson(Json.parse(json));
    }

    /**
     * Plain Java values: maps, lists, strings, numbers, booleans and nulls.
     *
     * @throws XjxParseException if the value graph contains a cycle
     */
    public XNode fromValue(Object value) {
        requireAcyclic(value);
        return fromJson((JsonNode) Json.MAPPER.valueToTree(value));
    }

    /**
     * @throws XjxParseException      if the tree contains a cycle
     * @throws XjxValidationException if the tree is null or structurally unusable
     */
    public XNode fromJson(JsonNode json) {
        if (json == null || json.isMissingNode()) throw new XjxValidationException("JSON was null");
        requireAcyclic(json);
        XNode root;
        String single = singleProperty(json);
        if (single != null) {
            root = convert(single, json.get(single), 0, true);
        } else {
            root = convert(config.rootName(), json, 0, true);
        }
        if (config.emptyValueHandling() == EmptyValueHandling.REMOVE) removeEmpty(root);
        log.debug("Read JSON into {} '{}' with {} children", root.type().code(), root.name(), root.children().size());
        return root;
    }

    private String singleProperty(JsonNode json) {
        if (!json.isObject() || json.size() != 1) return null;
        String key = json.fieldNames().next();
        return isAttributeKey(key) || JsonMarkers.isMarker(key) ? null : key;
    }

    private XNode convert(String name, JsonNode json, int depth, boolean root) {
        if (json.isNull()) return nullNode(name);
        if (json.isArray()) return collection(name, json, depth);
        if (json.isObject()) return record(name, json, depth);
        XNode node = XNode.value(name, scalar(json, name));
        if (!root && promoteToField(depth)) node = XNode.field(name, node.value());
        return node;
    }

    private XNode nullNode(String name) {
        return switch (config.emptyValueHandling()) {
            case NULL -> XNode.value(name, null);
            case UNDEFINED, REMOVE -> XNode.field(name);
        };
    }

    private boolean promoteToField(int depth) {
        return switch (config.fieldVsValue()) {
            case FIELD -> true;
            case VALUE -> false;
            case AUTO -> depth > 1;
        };
    }

    private XNode collection(String name, JsonNode array, int depth) {
        XNode collection = XNode.collection(name);
        String itemName = config.itemNameFor(name);
        boolean indexed = isHeterogeneous(array);
        int i = 0;
        for (JsonNode item : array) {
            collection.addChild(convert(indexed ? itemName + "_" + i : itemName, item, depth + 1, false));
            i++;
        }
        return collection;
    }

    /** Arrays mixing kinds of item get indexed item names. */
    private static boolean isHeterogeneous(JsonNode array) {
        Set<JsonNodeType> kinds = EnumSet.noneOf(JsonNodeType.class);
        for (JsonNode item : array) kinds.add(item.getNodeType());
        return kinds.size() > 1;
    }

    private XNode record(String name, JsonNode object, int depth) {
        XNode record = XNode.record(name);
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> e = fields.next();
            String key = e.getKey();
            JsonNode value = e.getValue();
            if (isAttributeKey(key)) {
                record.addAttribute(XNode.attribute(key.substring(config.attributePrefix().length()), scalar(value, key)));
            } else if (key.equals(JsonMarkers.VALUE)) {
                record.setValue(scalar(value, key));
            } else if (key.equals(JsonMarkers.TEXT) || key.equals(JsonMarkers.CDATA) || key.equals(JsonMarkers.COMMENT)
                    || isInstructionKey(key)) {
                Iterable<JsonNode> parts = value.isArray() ? value : List.of(value);
                for (JsonNode part : parts) record.addChild(markup(key, part));
            } else {
                record.addChild(convert(key, value, depth + 1, false));
            }
        }
        return record;
    }

    private XNode markup(String key, JsonNode part) {
        Object value = scalar(part, key);
        String text = value == null ? "" : value.toString();
        return switch (key) {
            case JsonMarkers.TEXT -> XNode.text(text);
            case JsonMarkers.CDATA -> XNode.data(text);
            case JsonMarkers.COMMENT -> XNode.comment(text);
            default -> XNode.instruction(key.substring(JsonMarkers.INSTRUCTION_PREFIX.length()), text);
        };
    }

    private boolean isAttributeKey(String key) {
        return key.startsWith(config.attributePrefix()) && key.length() > config.attributePrefix().length();
    }

    private static boolean isInstructionKey(String key) {
        return key.startsWith(JsonMarkers.INSTRUCTION_PREFIX) && key.length() > JsonMarkers.INSTRUCTION_PREFIX.length();
    }

    /** Removes valueless leaves, then any container emptied by that removal. The root is kept. */
    private static boolean removeEmpty(XNode node) {
        boolean hadChildren = node.hasChildren();
        for (XNode child : new ArrayList<>(node.children())) {
            if (removeEmpty(child)) node.removeChild(child);
        }
        if (node.isRoot() || node.hasAttributes() || node.hasChildren()) return false;
        if (node.type().isScalar()) return !node.hasValue() || node.value() == null;
        return node.type().isContainer() && hadChildren && !node.hasValue();
    }

    // ---------- high fidelity ----------

    public XNode fromHiFi(String json) {
        if (json == null) throw new XjxValidationException("JSON was null");
        return fromHiFi(Json.parse(json));
    }

    /**
     * A JSON value without {@code #type} and {@code #name} at the root is read as standard JSON.
     *
     * @throws XjxValidationException if a node has an unknown {@code #type} or a malformed shape
     */
    public XNode fromHiFi(JsonNode json) {
        if (json == null || json.isMissingNode()) throw new XjxValidationException("JSON was null");
        requireAcyclic(json);
        if (!isHiFi(json)) {
            log.debug("JSON root has no {}/{} markers, reading it as standard JSON", JsonMarkers.TYPE, JsonMarkers.NAME);
            return fromJson(json);
        }
        XNode root = hiFiNode(json, "");
        log.debug("Read high-fidelity JSON into {} '{}'", root.type().code(), root.name());
        return root;
    }

    private static boolean isHiFi(JsonNode json) {
        return json.isObject() && json.path(JsonMarkers.TYPE).isTextual() && json.path(JsonMarkers.NAME).isTextual();
    }

    private XNode hiFiNode(JsonNode json, String where) {
        if (!isHiFi(json))
            throw new XjxValidationException("High-fidelity node at '" + where + "' needs string " + JsonMarkers.TYPE
                    + " and " + JsonMarkers.NAME);
        XNodeType type = XNodeType.fromCode(json.get(JsonMarkers.TYPE).asText());
        String name = json.get(JsonMarkers.NAME).asText();
        String path = where.isEmpty() ? name : where + "." + name;
        XNode node = XNode.of(type, name);
        if (json.has(JsonMarkers.VALUE)) node.setValue(scalar(json.get(JsonMarkers.VALUE), path));
        if (json.hasNonNull(JsonMarkers.ID)) node.setId(json.get(JsonMarkers.ID).asText());
        if (json.hasNonNull(JsonMarkers.NS)) node.setNs(json.get(JsonMarkers.NS).asText());
        if (json.hasNonNull(JsonMarkers.LABEL)) node.setLabel(json.get(JsonMarkers.LABEL).asText());
        for (JsonNode attr : hiFiList(json, JsonMarkers.ATTRIBUTES, path)) node.addAttribute(hiFiNode(attr, path));
        for (JsonNode child : hiFiList(json, JsonMarkers.CHILDREN, path)) node.addChild(hiFiNode(child, path));
        return node;
    }

    private static Iterable<JsonNode> hiFiList(JsonNode json, String key, String where) {
        JsonNode list = json.get(key);
        if (list == null || list.isNull()) return Collections.emptyList();
        if (!list.isArray()) throw new XjxValidationException(key + " at '" + where + "' must be an array");
        return list;
    }

    // ---------- helpers ----------

    private static Object scalar(JsonNode json, String where) {
        if (json.isNull()) return null;
        if (json.isTextual()) return json.asText();
        if (json.isBoolean()) return json.booleanValue();
        if (json.isNumber()) {
            Number n = json.numberValue();
            return n instanceof Double || n instanceof Float ? new BigDecimal(n.toString()) : n;
        }
        throw new XjxValidationException("Expected a scalar at '" + where + "', was " + json.getNodeType());
    }

    /**
     * @throws XjxParseException if the same container is reachable from itself
     */
    static void requireAcyclic(Object value) {
        checkCycles(value, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private static void checkCycles(Object value, Set<Object> onPath) {
        Iterable<?> kids;
        if (value instanceof JsonNode j) {
            if (!j.isContainerNode()) return;
            kids = j;
        }
        else if (value instanceof Map<?, ?> m) kids = m.values();
        else if (value instanceof Iterable<?> it) kids = it;
        else return;
        if (!onPath.add(value)) throw new XjxParseException("JSON contains circular references");
        for (Object kid : kids) checkCycles(kid, onPath);
        onPath.remove(value);
    }
}
