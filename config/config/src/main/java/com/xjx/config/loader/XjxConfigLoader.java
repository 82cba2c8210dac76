package com.xjx.config.loader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.xjx.common.errorsor.ErrorsOr;
import com.xjx.config.XjxConfig;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static com.xjx.config.loader.BaseConfigLoader.base;

/**
 * Loads {@link XjxConfig} from JSON. The document may be partial: it is merged over
 * {@link XjxConfig#defaults()} before being bound.
 */
public interface XjxConfigLoader {

    ObjectMapper JSON = base(new ObjectMapper());
    ObjectReader CONFIG_READER = JSON.readerFor(XjxConfig.class);

    // -------- Parse from JSON --------

    static ErrorsOr<XjxConfig> fromJson(InputStream in) {
        try {
            JsonNode tree = JSON.readTree(in);
            if (tree == null || tree.isMissingNode()) return ErrorsOr.lift(XjxConfig.defaults());
            if (!tree.isObject()) return ErrorsOr.error("XjxConfig must be a JSON object, was " + tree.getNodeType());
            return merge(XjxConfig.defaults(), tree);
        } catch (Exception e) {
            return ErrorsOr.error("Failed to parse XjxConfig: {0}: {1}", e);
        }
    }

    static ErrorsOr<XjxConfig> fromJson(String json) {
        if (json == null || json.isBlank()) return ErrorsOr.lift(XjxConfig.defaults());
        try (InputStream in = new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))) {
            return fromJson(in);
        } catch (Exception e) {
            return ErrorsOr.error("Failed to read XjxConfig JSON: {0}: {1}", e);
        }
    }

    // -------- Load from classpath --------

    static ErrorsOr<XjxConfig> fromClasspath(String resourcePath) {
        return fromClasspath(resourcePath, Thread.currentThread().getContextClassLoader());
    }

    static ErrorsOr<XjxConfig> fromClasspath(String resourcePath, ClassLoader cl) {
        try {
            InputStream in = (cl == null) ? null : cl.getResourceAsStream(resourcePath);
            if (in == null) {
                ClassLoader fallback = XjxConfigLoader.class.getClassLoader();
                in = (fallback == null) ? null : fallback.getResourceAsStream(resourcePath);
            }
            if (in == null) {
                return ErrorsOr.error("Classpath resource not found: " + resourcePath);
            }
            try (InputStream autoClose = in) {
                return fromJson(autoClose).addPrefixIfError("xjxconfig '" + resourcePath + "': ");
            }
        } catch (Exception e) {
            return ErrorsOr.errors(List.of(
                    "Failed to load XjxConfig from classpath '" + resourcePath + "': "
                            + e.getClass().getSimpleName() + ": " + e.getMessage()));
        }
    }

    // -------- Merge --------

    /** Deep-merges {@code overrides} over {@code base} and binds the result. */
    static ErrorsOr<XjxConfig> merge(XjxConfig base, JsonNode overrides) {
        try {
            JsonNode merged = ConfigMerger.merge(JSON.valueToTree(base), overrides);
            XjxConfig config = CONFIG_READER.readValue(merged);
            List<String> errs = validate(config);
            return errs.isEmpty() ? ErrorsOr.lift(config) : ErrorsOr.errors(errs);
        } catch (Exception e) {
            return ErrorsOr.error("Invalid XjxConfig: {0}: {1}", e);
        }
    }

    static ObjectMapper strictJson() {
        return JSON;
    }

    static String toJson(XjxConfig config) {
        try {
            return JSON.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (Exception e) {
            throw new IllegalStateException("Cannot render XjxConfig", e);
        }
    }

    // -------- Validation: return list of error strings (empty = OK) --------

    private static List<String> validate(XjxConfig config) {
        List<String> errs = new ArrayList<>();
        var itemNames = config.json().source().arrayItemNames();
        itemNames.forEach((property, item) -> {
            if (item == null || item.isBlank()) errs.add("json.source.arrayItemNames['" + property + "'] must be non-empty");
        });
        if (config.json().source().attributePrefix().startsWith("#"))
            errs.add("json.source.attributePrefix must not start with '#', which is reserved for markers");
        if (config.json().output().attributePrefix().startsWith("#"))
            errs.add("json.output.attributePrefix must not start with '#', which is reserved for markers");
        return errs;
    }
}
