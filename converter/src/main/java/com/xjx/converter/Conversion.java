package com.xjx.converter;

import com.xjx.common.errorsor.ErrorsOr;
import com.xjx.config.XjxConfig;

import java.util.Arrays;
import java.util.function.BiFunction;
import java.util.stream.Collectors;

/**
 * Named string-to-string conversions, resolvable by entry name such as {@code xmlToJson}.
 */
public enum Conversion {
    XML_TO_JSON("xmlToJson", (xjx, in) -> xjx.withConfig(xjx.config().withHighFidelity(false)).fromXml(in).toJsonString()),
    XML_TO_JSON_HIFI("xmlToJsonHiFi", (xjx, in) -> xjx.fromXml(in).toJsonHiFiString()),
    JSON_TO_XML("jsonToXml", (xjx, in) -> xjx.withConfig(xjx.config().withHighFidelity(false)).fromJson(in).toXmlString()),
    JSON_HIFI_TO_XML("jsonHiFiToXml", (xjx, in) -> xjx.fromJsonHiFi(in).toXmlString()),
    XML_TO_XML("xmlToXml", (xjx, in) -> xjx.fromXml(in).toXmlString()),
    JSON_TO_JSON("jsonToJson", (xjx, in) -> xjx.fromJson(in).toJsonString());

    private final String entryName;
    private final BiFunction<Xjx, String, String> body;

    Conversion(String entryName, BiFunction<Xjx, String, String> body) {
        this.entryName = entryName;
        this.body = body;
    }

    public String entryName() {
        return entryName;
    }

    public static ErrorsOr<Conversion> named(String name) {
        for (Conversion c : values()) if (c.entryName.equals(name)) return ErrorsOr.lift(c);
        return ErrorsOr.error("Unknown conversion '" + name + "'. Legal values are "
                + Arrays.stream(values()).map(Conversion::entryName).collect(Collectors.joining(", ")));
    }

    public ErrorsOr<String> apply(String input) {
        return apply(input, XjxConfig.defaults());
    }

    public ErrorsOr<String> apply(String input, XjxConfig config) {
        return ErrorsOr.trying(() -> body.apply(Xjx.create().withConfig(config), input))
                .addPrefixIfError(entryName + ": ");
    }

    public static ErrorsOr<String> apply(String name, String input, XjxConfig config) {
        return named(name).flatMap(c -> c.apply(input, config));
    }
}
