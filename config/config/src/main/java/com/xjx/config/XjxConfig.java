package com.xjx.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.xjx.common.exceptions.XjxValidationException;
import com.xjx.config.loader.XjxConfigLoader;

import java.util.Map;
import java.util.Objects;

/**
 * Complete configuration for one conversion. Always passed explicitly;
 * {@link #defaults()} is the configuration used when a caller supplies none.
 *
 * @param highFidelity whether JSON sources and outputs use the marker-based lossless shape
 */
public record XjxConfig(XmlConfig xml, JsonConfig json, boolean highFidelity) {

    public XjxConfig {
        Objects.requireNonNull(xml, "xml");
        Objects.requireNonNull(json, "json");
    }

    public static XjxConfig defaults() {
        return new XjxConfig(XmlConfig.defaults(), JsonConfig.defaults(), false);
    }

    public XjxConfig withXml(XmlConfig xml) {
        return new XjxConfig(xml, json, highFidelity);
    }

    public XjxConfig withJson(JsonConfig json) {
        return new XjxConfig(xml, json, highFidelity);
    }

    public XjxConfig withHighFidelity(boolean highFidelity) {
        return new XjxConfig(xml, json, highFidelity);
    }

    public XjxConfig withXmlSource(XmlSourceConfig source) {
        return withXml(new XmlConfig(source, xml.output()));
    }

    public XjxConfig withXmlOutput(XmlOutputConfig output) {
        return withXml(new XmlConfig(xml.source(), output));
    }

    public XjxConfig withJsonSource(JsonSourceConfig source) {
        return withJson(new JsonConfig(source, json.output()));
    }

    public XjxConfig withJsonOutput(JsonOutputConfig output) {
        return withJson(new JsonConfig(json.source(), output));
    }

    /**
     * Deep-merges a partial configuration over this one. Objects merge key by key,
     * anything else replaces.
     *
     * @throws XjxValidationException if the merged result is not a valid configuration
     */
    public XjxConfig merge(JsonNode overrides) {
        return XjxConfigLoader.merge(this, overrides)
                .valueOrThrow(errs -> new XjxValidationException(String.join("; ", errs)));
    }

    public XjxConfig merge(Map<String, ?> overrides) {
        return merge((JsonNode) XjxConfigLoader.strictJson().valueToTree(overrides));
    }
}
