package com.xjx.config;

import java.util.Objects;

public record JsonConfig(JsonSourceConfig source, JsonOutputConfig output) {
    public JsonConfig {
        Objects.requireNonNull(source, "json.source");
        Objects.requireNonNull(output, "json.output");
    }

    public static JsonConfig defaults() {
        return new JsonConfig(JsonSourceConfig.defaults(), JsonOutputConfig.defaults());
    }
}
