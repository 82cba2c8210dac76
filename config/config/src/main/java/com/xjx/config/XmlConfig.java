package com.xjx.config;

import java.util.Objects;

public record XmlConfig(XmlSourceConfig source, XmlOutputConfig output) {
    public XmlConfig {
        Objects.requireNonNull(source, "xml.source");
        Objects.requireNonNull(output, "xml.output");
    }

    public static XmlConfig defaults() {
        return new XmlConfig(XmlSourceConfig.defaults(), XmlOutputConfig.defaults());
    }
}
